package com.has.domain.session.dto;

import lombok.Builder;
import lombok.Getter;

// 상태별 세션 수 + 금액 합계
@Getter
@Builder
public class StatusAggregate {
    private final String status;
    private final long count;
    private final long totalAmount;
}
