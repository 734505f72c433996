package com.has.domain.tracking.repository;

import com.has.domain.tracking.entity.LocationTracking;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Mono;

public interface LocationTrackingRepository extends ReactiveCrudRepository<LocationTracking, Long> {

    Mono<LocationTracking> findBySessionIdAndIsActiveTrue(Long sessionId);

    Mono<Boolean> existsBySessionIdAndIsActiveTrue(Long sessionId);

    Mono<LocationTracking> findBySessionIdAndProviderIdAndIsActiveTrue(Long sessionId, Long providerId);
}
