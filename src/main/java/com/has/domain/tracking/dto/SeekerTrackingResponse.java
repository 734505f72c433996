package com.has.domain.tracking.dto;

import com.has.domain.tracking.entity.LocationTracking;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDateTime;

// 수요자 화면용. 추적 시작 전이면 trackingActive=false와 안내 메시지만 담는다
@Getter
@Builder
public class SeekerTrackingResponse {
    private Long sessionId;
    private boolean trackingActive;
    private String message;
    private Long providerId;
    private String status;
    private TrackingResponse.Coordinate providerLocation;
    private TrackingResponse.Coordinate serviceLocation;
    private Double distanceToDestination;
    private LocalDateTime estimatedArrivalTime;
    private LocalDateTime arrivedAt;
    private LocalDateTime serviceStartedAt;
    private LocalDateTime serviceCompletedAt;

    public static SeekerTrackingResponse notStarted(Long sessionId) {
        return SeekerTrackingResponse.builder()
                .sessionId(sessionId)
                .trackingActive(false)
                .message("Location tracking not started yet")
                .build();
    }

    public static SeekerTrackingResponse from(LocationTracking tracking) {
        return SeekerTrackingResponse.builder()
                .sessionId(tracking.getSessionId())
                .trackingActive(Boolean.TRUE.equals(tracking.getIsActive()))
                .providerId(tracking.getProviderId())
                .status(tracking.getStatus())
                .providerLocation(TrackingResponse.Coordinate.builder()
                        .latitude(tracking.getCurrentLatitude())
                        .longitude(tracking.getCurrentLongitude())
                        .build())
                .serviceLocation(TrackingResponse.Coordinate.builder()
                        .latitude(tracking.getServiceLatitude())
                        .longitude(tracking.getServiceLongitude())
                        .build())
                .distanceToDestination(tracking.getDistanceToDestination())
                .estimatedArrivalTime(tracking.getEstimatedArrivalTime())
                .arrivedAt(tracking.getArrivedAt())
                .serviceStartedAt(tracking.getServiceStartedAt())
                .serviceCompletedAt(tracking.getServiceCompletedAt())
                .build();
    }
}
