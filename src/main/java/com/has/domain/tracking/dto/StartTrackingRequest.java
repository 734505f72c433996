package com.has.domain.tracking.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class StartTrackingRequest {
    @NotNull
    private Long sessionId;

    @NotNull
    private Double providerLatitude;
    @NotNull
    private Double providerLongitude;

    // 비어 있으면 세션에 저장된 서비스 위치 사용
    private Double serviceLatitude;
    private Double serviceLongitude;
}
