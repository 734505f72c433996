package com.has.domain.pricing.dto;

import com.has.domain.pricing.entity.CategoryPricing;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class CategoryPricingResponse {
    private String category;
    private Integer baseSessionPrice;
    private Double baseSessionDuration;
    private Integer overtimeRate;
    private Integer overtimeIncrement;

    public static CategoryPricingResponse from(CategoryPricing pricing) {
        return CategoryPricingResponse.builder()
                .category(pricing.getCategory())
                .baseSessionPrice(pricing.getBaseSessionPrice())
                .baseSessionDuration(pricing.getBaseSessionDuration())
                .overtimeRate(pricing.getOvertimeRate())
                .overtimeIncrement(pricing.getOvertimeIncrement())
                .build();
    }
}
