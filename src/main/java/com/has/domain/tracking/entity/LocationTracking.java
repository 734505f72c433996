package com.has.domain.tracking.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

// 세션당 활성 레코드는 최대 1개 (session_id WHERE is_active 부분 유니크 인덱스)
@Table("location_trackings")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LocationTracking {

    @Id
    private Long id;

    private Long sessionId;

    private Long providerId;

    private Long seekerId;

    // 제공자 현재 위치
    private Double currentLatitude;
    private Double currentLongitude;

    // 서비스 장소
    private Double serviceLatitude;
    private Double serviceLongitude;

    private String status;                   // LocationStatus

    private Double distanceToDestination;    // 미터
    private Double speed;                    // m/s
    private Double accuracy;                 // 미터

    private LocalDateTime estimatedArrivalTime;
    private LocalDateTime arrivedAt;
    private LocalDateTime serviceStartedAt;
    private LocalDateTime serviceCompletedAt;

    private Boolean isActive;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
