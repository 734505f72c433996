package com.has.domain.wallet.entity;

public enum TransactionType {
    EARNING,      // 완료 세션 정산 (수수료 차감 후)
    COMMISSION,   // 플랫폼 수수료 (음수 금액)
    WITHDRAWAL,
    REFUND
}
