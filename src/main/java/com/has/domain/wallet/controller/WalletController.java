package com.has.domain.wallet.controller;

import com.has.domain.wallet.entity.Wallet;
import com.has.domain.wallet.entity.WalletTransaction;
import com.has.domain.wallet.service.WalletService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Tag(name = "Wallet", description = "제공자 지갑 조회 API")
@RestController
@RequestMapping("/api/v1/wallet")
@RequiredArgsConstructor
public class WalletController {

    private final WalletService walletService;

    @Operation(summary = "내 지갑 조회")
    @GetMapping("/me")
    public Mono<ResponseEntity<Wallet>> myWallet(@RequestHeader("X-User-Id") Long providerId) {
        return walletService.getOrCreateWallet(providerId)
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "내 거래 내역", description = "정산(EARNING)과 수수료(COMMISSION) 내역을 최신순으로 반환합니다.")
    @GetMapping("/me/transactions")
    public Flux<WalletTransaction> myTransactions(@RequestHeader("X-User-Id") Long providerId) {
        return walletService.getTransactions(providerId);
    }
}
