package com.has.domain.admin.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class AssignProviderRequest {
    @NotNull
    private Long providerId;
    private String notes;
}
