package com.has.domain.user.entity;

public enum UserRole {
    SEEKER,
    PROVIDER,
    ADMIN
}
