package com.has.domain.catalog.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

// 서비스 카탈로그 항목. providerId가 없으면 카테고리별 일반 서비스(배정 요청용 템플릿)
@Table("services")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServiceListing {

    @Id
    private Long id;

    private Long providerId;

    private String title;

    private String description;

    private String category;                 // ServiceCategory

    private String status;                   // ACTIVE, INACTIVE, SUSPENDED

    private Boolean isAvailable;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
