package com.has.domain.availability.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class TimeSlotRequest {
    @NotBlank
    @Pattern(regexp = "^([01]\\d|2[0-3]):([0-5]\\d)$", message = "시간은 HH:mm 형식이어야 합니다")
    private String startTime;

    @NotBlank
    @Pattern(regexp = "^([01]\\d|2[0-3]):([0-5]\\d)$", message = "시간은 HH:mm 형식이어야 합니다")
    private String endTime;

    private Boolean isAvailable;
}
