package com.has.domain.user.dto;

import com.has.domain.catalog.entity.CameroonProvince;
import com.has.domain.catalog.entity.ServiceCategory;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class ProviderSearchCondition {
    private ServiceCategory category;
    private CameroonProvince area;           // null이면 지역 조건 생략
    private Double minRating;
    private String experienceLevel;
}
