package com.has.domain.availability.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

// 제공자의 요일별 반복 가용 시간. (provider_id, day_of_week) 유일
@Table("availabilities")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Availability {

    @Id
    private Long id;

    private Long providerId;

    private String dayOfWeek;                // java.time.DayOfWeek (MONDAY ~ SUNDAY)

    private Boolean isActive;

    private String notes;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
