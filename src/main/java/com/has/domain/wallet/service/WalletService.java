package com.has.domain.wallet.service;

import com.has.domain.pricing.constants.PricingConstants;
import com.has.domain.wallet.entity.TransactionType;
import com.has.domain.wallet.entity.Wallet;
import com.has.domain.wallet.entity.WalletTransaction;
import com.has.domain.wallet.repository.WalletRepository;
import com.has.domain.wallet.repository.WalletTransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;

@Slf4j
@Service
@RequiredArgsConstructor
public class WalletService {

    static final BigDecimal COMMISSION_RATE = new BigDecimal("0.10");
    private static final String COMPLETED = "COMPLETED";

    private final WalletRepository walletRepository;
    private final WalletTransactionRepository walletTransactionRepository;

    public Mono<Wallet> getOrCreateWallet(Long providerId) {
        return walletRepository.findByProviderId(providerId)
                .switchIfEmpty(Mono.defer(() -> walletRepository.save(Wallet.builder()
                                .providerId(providerId)
                                .balance(0L)
                                .pendingBalance(0L)
                                .totalEarnings(0L)
                                .totalWithdrawn(0L)
                                .currency(PricingConstants.CURRENCY)
                                .createdAt(LocalDateTime.now())
                                .updatedAt(LocalDateTime.now())
                                .build())
                        .doOnSuccess(w -> log.info("지갑 생성: providerId={}, walletId={}", providerId, w.getId()))));
    }

    // 완료 세션 정산. 같은 세션의 EARNING이 이미 있으면 아무것도 하지 않는다
    // 수수료 10%를 COMMISSION 거래로 남기고, 잔액/누적 수익에는 차감 후 금액만 더한다
    @Transactional
    public Mono<Void> processEarning(Long providerId, Long sessionId, long amount) {
        return walletTransactionRepository.existsBySessionIdAndType(sessionId, TransactionType.EARNING.name())
                .flatMap(exists -> {
                    if (Boolean.TRUE.equals(exists)) {
                        log.info("이미 정산된 세션: sessionId={}, providerId={}", sessionId, providerId);
                        return Mono.empty();
                    }
                    long commission = commissionOf(amount);
                    long net = amount - commission;
                    return getOrCreateWallet(providerId)
                            .flatMap(wallet -> walletTransactionRepository.save(
                                            transaction(wallet, sessionId, TransactionType.EARNING, net,
                                                    "Earning from completed session"))
                                    .then(walletTransactionRepository.save(
                                            transaction(wallet, sessionId, TransactionType.COMMISSION, -commission,
                                                    "Platform commission (10%)")))
                                    .then(Mono.defer(() -> {
                                        wallet.setBalance(wallet.getBalance() + net);
                                        wallet.setTotalEarnings(wallet.getTotalEarnings() + net);
                                        // 결제 대기 금액에 잡혀 있던 경우 정리
                                        if (wallet.getPendingBalance() >= amount) {
                                            wallet.setPendingBalance(wallet.getPendingBalance() - amount);
                                        }
                                        wallet.setUpdatedAt(LocalDateTime.now());
                                        return walletRepository.save(wallet);
                                    })))
                            .doOnSuccess(wallet -> log.info("세션 정산 완료: sessionId={}, providerId={}, amount={}, commission={}, net={}",
                                    sessionId, providerId, amount, commission, net))
                            .then();
                });
    }

    public Flux<WalletTransaction> getTransactions(Long providerId) {
        return walletTransactionRepository.findByProviderIdOrderByCreatedAtDesc(providerId);
    }

    static long commissionOf(long amount) {
        return BigDecimal.valueOf(amount)
                .multiply(COMMISSION_RATE)
                .setScale(0, RoundingMode.HALF_UP)
                .longValueExact();
    }

    private static WalletTransaction transaction(Wallet wallet, Long sessionId, TransactionType type,
                                                 long amount, String description) {
        LocalDateTime now = LocalDateTime.now();
        return WalletTransaction.builder()
                .walletId(wallet.getId())
                .providerId(wallet.getProviderId())
                .sessionId(sessionId)
                .type(type.name())
                .amount(amount)
                .status(COMPLETED)
                .description(description)
                .processedAt(now)
                .createdAt(now)
                .build();
    }
}
