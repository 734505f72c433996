package com.has.domain.catalog.entity;

public enum ServiceCategory {
    CLEANING,
    PLUMBING,
    ELECTRICAL,
    PAINTING,
    GARDENING,
    CARPENTRY,
    COOKING,
    TUTORING,
    BEAUTY,
    MAINTENANCE,
    OTHER
}
