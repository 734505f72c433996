package com.has.domain.user.entity;

public enum ProviderStatus {
    PENDING,      // 심사 대기
    ACTIVE,       // 배정 가능
    SUSPENDED,    // 일시 정지
    REJECTED      // 심사 거절
}
