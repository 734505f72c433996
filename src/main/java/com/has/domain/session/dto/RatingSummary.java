package com.has.domain.session.dto;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class RatingSummary {
    private final double averageRating;
    private final long totalReviews;
}
