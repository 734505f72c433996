package com.has.domain.session.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class ReviewRequest {
    @NotNull
    private Integer rating;                  // 1 ~ 5
    private String review;
}
