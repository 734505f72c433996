package com.has.domain.pricing.dto;

import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.Setter;

// 전달된 항목만 변경
@Getter
@Setter
public class CategoryPricingUpdateRequest {
    @Positive
    private Integer baseSessionPrice;
    @Positive
    private Double baseSessionDuration;
    @Positive
    private Integer overtimeRate;
    @Positive
    private Integer overtimeIncrement;
}
