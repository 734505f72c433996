package com.has.domain.wallet.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

// 제공자 지갑. 금액 단위 FCFA
@Table("wallets")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Wallet {

    @Id
    private Long id;

    private Long providerId;

    private Long balance;

    private Long pendingBalance;

    private Long totalEarnings;

    private Long totalWithdrawn;

    private String currency;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
