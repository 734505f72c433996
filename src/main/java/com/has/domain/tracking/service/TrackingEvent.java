package com.has.domain.tracking.service;

// 위치 갱신으로 자동 발생하는 추적 이벤트
public enum TrackingEvent {
    ARRIVED
}
