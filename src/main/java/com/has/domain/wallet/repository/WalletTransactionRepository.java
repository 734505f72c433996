package com.has.domain.wallet.repository;

import com.has.domain.wallet.entity.WalletTransaction;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface WalletTransactionRepository extends ReactiveCrudRepository<WalletTransaction, Long> {

    Mono<Boolean> existsBySessionIdAndType(Long sessionId, String type);

    Flux<WalletTransaction> findByProviderIdOrderByCreatedAtDesc(Long providerId);
}
