package com.has.domain.admin.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class RejectRequestRequest {
    @NotBlank
    private String reason;
    private String adminNotes;
}
