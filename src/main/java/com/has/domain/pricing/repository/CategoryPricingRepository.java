package com.has.domain.pricing.repository;

import com.has.domain.pricing.entity.CategoryPricing;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface CategoryPricingRepository extends ReactiveCrudRepository<CategoryPricing, Long> {

    Flux<CategoryPricing> findByConfigIdOrderByCategory(Long configId);

    Mono<CategoryPricing> findByConfigIdAndCategory(Long configId, String category);
}
