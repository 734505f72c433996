package com.has.domain.admin.dto;

import com.has.domain.session.dto.SessionResponse;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
public class AvailableProvidersResponse {
    private SessionResponse session;
    private List<AvailableProviderResponse> providers;
    private int totalFound;
}
