package com.has.domain.tracking.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class LocationUpdateRequest {
    @NotNull
    private Double latitude;
    @NotNull
    private Double longitude;
    private Double accuracy;
    private Double speed;
}
