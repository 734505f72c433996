package com.has.domain.pricing.service;

import com.has.domain.catalog.entity.ServiceCategory;
import com.has.domain.pricing.dto.PricingResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

@Slf4j
@Service
@RequiredArgsConstructor
public class SessionPricingService {

    private final CategoryPricingProvider categoryPricingProvider;

    // 시간이 바뀔 때마다 다시 호출할 것 (결과 캐시 금지)
    public Mono<PricingResult> calculateSessionPrice(ServiceCategory category, double durationHours) {
        return categoryPricingProvider.getCategoryPricing(category)
                .map(pricing -> PricingCalculator.calculate(pricing, durationHours))
                .doOnSuccess(result -> log.debug("세션 가격 계산: category={}, duration={}, total={}",
                        category, durationHours, result.getTotalPrice()));
    }
}
