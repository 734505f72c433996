package com.has.domain.tracking.dto;

import com.has.domain.tracking.entity.LocationTracking;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDateTime;

@Getter
@Builder
public class TrackingResponse {
    private Long id;
    private Long sessionId;
    private String status;
    private Coordinate currentLocation;
    private Coordinate serviceLocation;
    private Double distanceToDestination;
    private Double speed;
    private Double accuracy;
    private LocalDateTime estimatedArrivalTime;
    private LocalDateTime arrivedAt;
    private LocalDateTime serviceStartedAt;
    private LocalDateTime serviceCompletedAt;
    private Boolean isActive;

    @Getter
    @Builder
    public static class Coordinate {
        private Double latitude;
        private Double longitude;
    }

    public static TrackingResponse from(LocationTracking tracking) {
        return TrackingResponse.builder()
                .id(tracking.getId())
                .sessionId(tracking.getSessionId())
                .status(tracking.getStatus())
                .currentLocation(Coordinate.builder()
                        .latitude(tracking.getCurrentLatitude())
                        .longitude(tracking.getCurrentLongitude())
                        .build())
                .serviceLocation(Coordinate.builder()
                        .latitude(tracking.getServiceLatitude())
                        .longitude(tracking.getServiceLongitude())
                        .build())
                .distanceToDestination(tracking.getDistanceToDestination())
                .speed(tracking.getSpeed())
                .accuracy(tracking.getAccuracy())
                .estimatedArrivalTime(tracking.getEstimatedArrivalTime())
                .arrivedAt(tracking.getArrivedAt())
                .serviceStartedAt(tracking.getServiceStartedAt())
                .serviceCompletedAt(tracking.getServiceCompletedAt())
                .isActive(tracking.getIsActive())
                .build();
    }
}
