package com.has.domain.session.dto;

import lombok.Builder;
import lombok.Getter;

import java.util.List;
import java.util.Map;

// 목록 + 페이지 정보 + 상태별 요약
@Getter
@Builder
public class SessionListResponse {
    private List<SessionResponse> sessions;
    private Pagination pagination;
    private Summary summary;

    @Getter
    @Builder
    public static class Pagination {
        private int page;
        private int limit;
        private long total;
        private int totalPages;
    }

    @Getter
    @Builder
    public static class Summary {
        private long totalSessions;
        private Map<String, Long> statusCounts;
        // 제공자 목록에서만: 완료 세션 금액 합계
        private Long totalEarnings;
    }
}
