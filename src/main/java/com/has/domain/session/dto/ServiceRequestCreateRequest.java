package com.has.domain.session.dto;

import com.has.domain.catalog.entity.CameroonProvince;
import com.has.domain.catalog.entity.ServiceCategory;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;

// 제공자를 지정하지 않은 서비스 요청. 관리자가 이후 제공자를 배정
@Getter
@Setter
public class ServiceRequestCreateRequest {
    @NotNull
    private ServiceCategory category;

    @NotNull
    private LocalDate serviceDate;

    @NotNull
    @Pattern(regexp = "^([01]\\d|2[0-3]):([0-5]\\d)$", message = "시간은 HH:mm 형식이어야 합니다")
    private String startTime;

    @NotNull
    @DecimalMin("0.5")
    @DecimalMax("12")
    private Double duration;

    @NotNull
    private CameroonProvince province;

    private String serviceAddress;
    private Double latitude;
    private Double longitude;

    private String specialInstructions;
    private String description;
}
