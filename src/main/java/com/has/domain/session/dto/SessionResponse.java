package com.has.domain.session.dto;

import com.has.domain.session.entity.Session;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Getter
@Builder
public class SessionResponse {
    private Long id;
    private Long seekerId;
    private Long providerId;
    private Long serviceId;
    private String serviceName;
    private String category;
    private LocalDate sessionDate;
    private String startTime;
    private String endTime;
    private Double duration;
    private Double baseDuration;
    private Double overtimeHours;
    private Integer basePrice;
    private Integer overtimePrice;
    private Integer totalAmount;
    private String currency;
    private String status;
    private String paymentStatus;
    private String notes;
    private String cancellationReason;
    private Long assignedBy;
    private LocalDateTime assignedAt;
    private String assignmentNotes;
    private String rejectionReason;
    private String serviceLocation;
    private String serviceAddress;
    private Integer seekerRating;
    private String seekerReview;
    private Integer providerRating;
    private String providerReview;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static SessionResponse from(Session session) {
        return SessionResponse.builder()
                .id(session.getId())
                .seekerId(session.getSeekerId())
                .providerId(session.getProviderId())
                .serviceId(session.getServiceId())
                .serviceName(session.getServiceName())
                .category(session.getCategory())
                .sessionDate(session.getSessionDate())
                .startTime(session.getStartTime())
                .endTime(session.getEndTime())
                .duration(session.getDuration())
                .baseDuration(session.getBaseDuration())
                .overtimeHours(session.getOvertimeHours())
                .basePrice(session.getBasePrice())
                .overtimePrice(session.getOvertimePrice())
                .totalAmount(session.getTotalAmount())
                .currency(session.getCurrency())
                .status(session.getStatus())
                .paymentStatus(session.getPaymentStatus())
                .notes(session.getNotes())
                .cancellationReason(session.getCancellationReason())
                .assignedBy(session.getAssignedBy())
                .assignedAt(session.getAssignedAt())
                .assignmentNotes(session.getAssignmentNotes())
                .rejectionReason(session.getRejectionReason())
                .serviceLocation(session.getServiceLocation())
                .serviceAddress(session.getServiceAddress())
                .seekerRating(session.getSeekerRating())
                .seekerReview(session.getSeekerReview())
                .providerRating(session.getProviderRating())
                .providerReview(session.getProviderReview())
                .createdAt(session.getCreatedAt())
                .updatedAt(session.getUpdatedAt())
                .build();
    }
}
