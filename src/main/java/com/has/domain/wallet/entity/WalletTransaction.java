package com.has.domain.wallet.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

// (session_id, type) 유니크 인덱스로 세션당 EARNING 1건 보장
@Table("wallet_transactions")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WalletTransaction {

    @Id
    private Long id;

    private Long walletId;

    private Long providerId;

    private Long sessionId;

    private String type;                     // TransactionType

    private Long amount;

    private String status;                   // COMPLETED

    private String description;

    private LocalDateTime processedAt;

    private LocalDateTime createdAt;
}
