package com.has.domain.pricing.dto;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class PricingResult {
    private int basePrice;
    private int overtimePrice;
    private int totalPrice;
    private double baseDuration;
    private double overtimeHours;
}
