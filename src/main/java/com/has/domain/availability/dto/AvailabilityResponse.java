package com.has.domain.availability.dto;

import com.has.domain.availability.entity.Availability;
import com.has.domain.availability.entity.AvailabilityTimeSlot;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
public class AvailabilityResponse {
    private Long id;
    private Long providerId;
    private String dayOfWeek;
    private Boolean isActive;
    private String notes;
    private List<TimeSlotDto> timeSlots;

    @Getter
    @Builder
    public static class TimeSlotDto {
        private String startTime;
        private String endTime;
        private Boolean isAvailable;
    }

    public static AvailabilityResponse of(Availability availability, List<AvailabilityTimeSlot> slots) {
        return AvailabilityResponse.builder()
                .id(availability.getId())
                .providerId(availability.getProviderId())
                .dayOfWeek(availability.getDayOfWeek())
                .isActive(availability.getIsActive())
                .notes(availability.getNotes())
                .timeSlots(slots.stream()
                        .map(slot -> TimeSlotDto.builder()
                                .startTime(slot.getStartTime())
                                .endTime(slot.getEndTime())
                                .isAvailable(slot.getIsAvailable())
                                .build())
                        .toList())
                .build();
    }
}
