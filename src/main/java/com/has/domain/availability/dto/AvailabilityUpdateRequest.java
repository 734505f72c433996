package com.has.domain.availability.dto;

import jakarta.validation.Valid;
import lombok.Getter;
import lombok.Setter;

import java.util.List;

// 전달된 항목만 변경. timeSlots가 오면 기존 시간대 전체 교체
@Getter
@Setter
public class AvailabilityUpdateRequest {
    @Valid
    private List<TimeSlotRequest> timeSlots;
    private Boolean isActive;
    private String notes;
}
