package com.has.domain.pricing.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

@Table("category_pricing")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CategoryPricing {

    @Id
    private Long id;

    private Long configId;

    private String category;                 // ServiceCategory

    private Integer baseSessionPrice;        // 기본 세션 가격 (FCFA)
    private Double baseSessionDuration;      // 기본 세션 시간 (시간)
    private Integer overtimeRate;            // 초과 단위당 가격 (FCFA)
    private Integer overtimeIncrement;       // 초과 과금 단위 (분)

    private LocalDateTime updatedAt;
}
