package com.has.domain.pricing.dto;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
public class SessionConfigResponse {
    private Long id;
    private Double defaultSessionDuration;
    private Integer defaultOvertimeIncrement;
    private String currency;
    private String notes;
    private List<CategoryPricingResponse> categoryPricing;
}
