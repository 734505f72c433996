package com.has.domain.session.dto;

import com.has.domain.catalog.entity.CameroonProvince;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;

@Getter
@Setter
public class SessionCreateRequest {
    @NotNull
    private Long serviceId;

    @NotNull
    private LocalDate sessionDate;

    @NotNull
    @Pattern(regexp = "^([01]\\d|2[0-3]):([0-5]\\d)$", message = "시간은 HH:mm 형식이어야 합니다")
    private String startTime;

    @NotNull
    @DecimalMin("0.5")
    @DecimalMax("12")
    private Double duration;                 // 시간 단위

    private String notes;

    private CameroonProvince serviceLocation;
    private String serviceAddress;
    private Double serviceLatitude;
    private Double serviceLongitude;
}
