package com.has.domain.availability.repository;

import com.has.domain.availability.entity.Availability;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface AvailabilityRepository extends ReactiveCrudRepository<Availability, Long> {

    Flux<Availability> findByProviderIdOrderByDayOfWeek(Long providerId);

    Mono<Availability> findByProviderIdAndDayOfWeek(Long providerId, String dayOfWeek);

    Mono<Availability> findByProviderIdAndDayOfWeekAndIsActiveTrue(Long providerId, String dayOfWeek);

    Mono<Boolean> existsByProviderIdAndDayOfWeek(Long providerId, String dayOfWeek);

    Mono<Availability> findByIdAndProviderId(Long id, Long providerId);
}
