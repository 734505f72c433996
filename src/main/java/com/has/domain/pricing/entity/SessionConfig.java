package com.has.domain.pricing.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

// 활성 설정은 항상 1건 (is_active 부분 유니크 인덱스)
@Table("session_configs")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionConfig {

    @Id
    private Long id;

    private Double defaultSessionDuration;   // 시간
    private Integer defaultOvertimeIncrement; // 분
    private String currency;
    private Boolean isActive;
    private String notes;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
