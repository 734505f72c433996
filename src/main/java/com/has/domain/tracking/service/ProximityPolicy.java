package com.has.domain.tracking.service;

import com.has.domain.tracking.entity.LocationStatus;
import org.springframework.stereotype.Component;

import java.util.Optional;

// 이동 중 서비스 장소 반경 100m 안에 들어오면 도착 처리
@Component
public class ProximityPolicy {

    static final double ARRIVAL_RADIUS_METERS = 100;

    public Optional<TrackingEvent> evaluate(LocationStatus status, double distanceMeters) {
        if (status == LocationStatus.ON_ROUTE && distanceMeters <= ARRIVAL_RADIUS_METERS) {
            return Optional.of(TrackingEvent.ARRIVED);
        }
        return Optional.empty();
    }
}
