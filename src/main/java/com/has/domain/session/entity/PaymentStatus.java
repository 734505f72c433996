package com.has.domain.session.entity;

public enum PaymentStatus {
    PENDING,
    PAID,
    FAILED,
    REFUNDED
}
