package com.has.domain.availability.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;

import java.time.DayOfWeek;
import java.util.List;

@Getter
@Setter
public class AvailabilityCreateRequest {
    @NotNull
    private DayOfWeek dayOfWeek;

    @NotEmpty
    @Valid
    private List<TimeSlotRequest> timeSlots;

    private String notes;
}
