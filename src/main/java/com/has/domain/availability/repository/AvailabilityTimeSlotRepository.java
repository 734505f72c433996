package com.has.domain.availability.repository;

import com.has.domain.availability.entity.AvailabilityTimeSlot;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface AvailabilityTimeSlotRepository extends ReactiveCrudRepository<AvailabilityTimeSlot, Long> {

    Flux<AvailabilityTimeSlot> findByAvailabilityIdOrderBySlotOrder(Long availabilityId);

    @Modifying
    @Query("DELETE FROM availability_time_slots WHERE availability_id = :availabilityId")
    Mono<Integer> deleteByAvailabilityId(Long availabilityId);
}
