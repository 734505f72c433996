package com.has.domain.admin.dto;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class AvailableProviderResponse {
    private Long id;
    private String fullName;
    private String email;
    private String phoneNumber;
    private String experienceLevel;
    private Double averageRating;
    private Integer totalReviews;
    // 제공자 마지막 위치 ~ 서비스 장소 (미터). 좌표가 없으면 null
    private Double distance;
}
