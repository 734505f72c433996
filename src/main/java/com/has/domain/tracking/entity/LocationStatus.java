package com.has.domain.tracking.entity;

// ON_ROUTE -> AT_LOCATION -> SERVICE_COMPLETE 순서로만 진행
public enum LocationStatus {
    ON_ROUTE,
    AT_LOCATION,
    SERVICE_COMPLETE
}
