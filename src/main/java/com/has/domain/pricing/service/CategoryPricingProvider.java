package com.has.domain.pricing.service;

import com.has.domain.catalog.entity.ServiceCategory;
import com.has.domain.pricing.entity.CategoryPricing;
import reactor.core.publisher.Mono;

/**
 * 카테고리별 요금 설정 조회 창구.
 * 요금 계산은 이 인터페이스로만 설정을 읽는다 (테스트 시 고정 설정 주입, 설정 변경 즉시 반영).
 */
public interface CategoryPricingProvider {

    /**
     * @return 카테고리 요금 설정. 설정이 없으면 CATEGORY_PRICING_NOT_FOUND 에러
     */
    Mono<CategoryPricing> getCategoryPricing(ServiceCategory category);
}
