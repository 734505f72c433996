package com.has.domain.pricing.repository;

import com.has.domain.pricing.entity.SessionConfig;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Mono;

public interface SessionConfigRepository extends ReactiveCrudRepository<SessionConfig, Long> {

    Mono<SessionConfig> findFirstByIsActiveTrue();
}
