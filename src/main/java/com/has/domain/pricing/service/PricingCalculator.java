package com.has.domain.pricing.service;

import com.has.domain.pricing.dto.PricingResult;
import com.has.domain.pricing.entity.CategoryPricing;

import java.math.BigDecimal;
import java.math.RoundingMode;

// 카테고리 요금 설정 + 요청 시간 → 가격. 설정이 같으면 항상 같은 결과
public final class PricingCalculator {

    private static final BigDecimal MINUTES_PER_HOUR = BigDecimal.valueOf(60);

    private PricingCalculator() {
        throw new UnsupportedOperationException("유틸리티 클래스는 인스턴스화할 수 없습니다.");
    }

    public static PricingResult calculate(CategoryPricing pricing, double durationHours) {
        double baseDuration = pricing.getBaseSessionDuration();
        int basePrice = pricing.getBaseSessionPrice();

        if (durationHours <= baseDuration) {
            return PricingResult.builder()
                    .basePrice(basePrice)
                    .overtimePrice(0)
                    .totalPrice(basePrice)
                    .baseDuration(baseDuration)
                    .overtimeHours(0)
                    .build();
        }

        // 십진수 연산으로 초과 시간을 구해 부동소수 오차로 과금 블록이 하나 더 붙는 것을 막는다
        BigDecimal overtimeHours = BigDecimal.valueOf(durationHours).subtract(BigDecimal.valueOf(baseDuration));
        // 남는 분은 한 블록으로 올림 과금
        long overtimeBlocks = overtimeHours.multiply(MINUTES_PER_HOUR)
                .divide(BigDecimal.valueOf(pricing.getOvertimeIncrement()), 0, RoundingMode.CEILING)
                .longValueExact();
        int overtimePrice = Math.toIntExact(overtimeBlocks * pricing.getOvertimeRate());

        return PricingResult.builder()
                .basePrice(basePrice)
                .overtimePrice(overtimePrice)
                .totalPrice(basePrice + overtimePrice)
                .baseDuration(baseDuration)
                .overtimeHours(overtimeHours.doubleValue())
                .build();
    }
}
