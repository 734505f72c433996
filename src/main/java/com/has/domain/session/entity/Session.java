package com.has.domain.session.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Table("sessions")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Session {

    @Id
    private Long id;

    private Long seekerId;

    private Long providerId;                 // PENDING_ASSIGNMENT 동안 null

    private Long serviceId;

    private String serviceName;

    private String category;                 // ServiceCategory

    private LocalDate sessionDate;

    private String startTime;                // HH:mm
    private String endTime;                  // HH:mm

    private Double duration;                 // 요청 시간 (시간)
    private Double baseDuration;
    private Double overtimeHours;

    private Integer basePrice;
    private Integer overtimePrice;
    private Integer totalAmount;             // basePrice + overtimePrice
    private String currency;                 // FCFA

    private String status;                   // SessionStatus
    private String paymentStatus;            // PaymentStatus

    private String notes;
    private String cancellationReason;

    // 관리자 배정
    private Long assignedBy;
    private LocalDateTime assignedAt;
    private String assignmentNotes;

    // 거절
    private String rejectionReason;
    private Long rejectedBy;
    private LocalDateTime rejectedAt;

    // 서비스 위치
    private String serviceLocation;          // CameroonProvince
    private String serviceAddress;
    private Double serviceLatitude;
    private Double serviceLongitude;

    // 상호 리뷰
    private Integer seekerRating;
    private String seekerReview;
    private Integer providerRating;
    private String providerReview;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public SessionStatus statusEnum() {
        return SessionStatus.valueOf(status);
    }

    public boolean isParticipant(Long userId) {
        return userId.equals(seekerId) || userId.equals(providerId);
    }
}
