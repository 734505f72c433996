package com.has.domain.session.dto;

import com.has.domain.session.entity.Session;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Getter
@Builder
public class ServiceRequestResponse {
    private Long requestId;
    private String category;
    private String status;
    private LocalDate serviceDate;
    private String startTime;
    private String endTime;
    private Double duration;
    private Integer estimatedCost;
    private String currency;
    private Long providerId;
    private LocalDateTime assignedAt;
    private String rejectionReason;
    private LocalDateTime createdAt;

    public static ServiceRequestResponse from(Session session) {
        return ServiceRequestResponse.builder()
                .requestId(session.getId())
                .category(session.getCategory())
                .status(session.getStatus())
                .serviceDate(session.getSessionDate())
                .startTime(session.getStartTime())
                .endTime(session.getEndTime())
                .duration(session.getDuration())
                .estimatedCost(session.getTotalAmount())
                .currency(session.getCurrency())
                .providerId(session.getProviderId())
                .assignedAt(session.getAssignedAt())
                .rejectionReason(session.getRejectionReason())
                .createdAt(session.getCreatedAt())
                .build();
    }
}
