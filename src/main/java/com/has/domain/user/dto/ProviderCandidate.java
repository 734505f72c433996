package com.has.domain.user.dto;

import com.has.domain.user.entity.ProviderProfile;
import com.has.domain.user.entity.User;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class ProviderCandidate {
    private User user;
    private ProviderProfile profile;

    public double rating() {
        return profile.getAverageRating() != null ? profile.getAverageRating() : 0.0;
    }
}
