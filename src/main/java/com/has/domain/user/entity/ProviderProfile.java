package com.has.domain.user.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

@Table("provider_profiles")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProviderProfile {

    @Id
    private Long id;

    private Long userId;

    private String status;                   // ProviderStatus

    // PostgreSQL text[] 컬럼
    private String[] serviceCategories;      // ServiceCategory 이름 목록
    private String[] serviceAreas;           // CameroonProvince 이름 목록

    private String experienceLevel;          // BEGINNER, INTERMEDIATE, EXPERT

    private Double averageRating;
    private Integer totalReviews;

    private String bio;

    // 마지막으로 보고된 위치
    private Double currentLatitude;
    private Double currentLongitude;
    private LocalDateTime lastLocationUpdate;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
