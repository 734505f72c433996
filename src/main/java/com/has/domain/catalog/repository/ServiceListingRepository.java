package com.has.domain.catalog.repository;

import com.has.domain.catalog.entity.ServiceListing;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Mono;

public interface ServiceListingRepository extends ReactiveCrudRepository<ServiceListing, Long> {

    // 카테고리별 일반 서비스 (제공자 미지정)
    Mono<ServiceListing> findFirstByCategoryAndProviderIdIsNull(String category);
}
