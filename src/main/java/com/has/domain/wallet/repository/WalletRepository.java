package com.has.domain.wallet.repository;

import com.has.domain.wallet.entity.Wallet;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Mono;

public interface WalletRepository extends ReactiveCrudRepository<Wallet, Long> {

    Mono<Wallet> findByProviderId(Long providerId);
}
