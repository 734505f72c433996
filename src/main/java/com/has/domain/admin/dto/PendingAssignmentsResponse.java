package com.has.domain.admin.dto;

import com.has.domain.session.dto.SessionListResponse;
import com.has.domain.session.dto.SessionResponse;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
public class PendingAssignmentsResponse {
    private List<SessionResponse> sessions;
    private SessionListResponse.Pagination pagination;
}
