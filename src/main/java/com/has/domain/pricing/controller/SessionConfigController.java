package com.has.domain.pricing.controller;

import com.has.domain.catalog.entity.ServiceCategory;
import com.has.domain.pricing.dto.CategoryPricingResponse;
import com.has.domain.pricing.dto.CategoryPricingUpdateRequest;
import com.has.domain.pricing.dto.PricingResult;
import com.has.domain.pricing.dto.SessionConfigResponse;
import com.has.domain.pricing.service.SessionConfigService;
import com.has.domain.pricing.service.SessionPricingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Tag(name = "Session Config", description = "카테고리별 세션 요금 설정 API")
@RestController
@RequiredArgsConstructor
public class SessionConfigController {

    private final SessionConfigService sessionConfigService;
    private final SessionPricingService sessionPricingService;

    @Operation(summary = "활성 세션 설정 조회 (관리자용)")
    @GetMapping("/api/v1/admin/session-config")
    public Mono<ResponseEntity<SessionConfigResponse>> getActiveConfig() {
        return sessionConfigService.getActiveConfigView()
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "카테고리 요금 목록 조회")
    @GetMapping("/api/v1/pricing/categories")
    public Flux<CategoryPricingResponse> getAllCategoryPricing() {
        return sessionConfigService.getAllCategoryPricing()
                .map(CategoryPricingResponse::from);
    }

    @Operation(summary = "카테고리 요금 조회")
    @GetMapping("/api/v1/pricing/categories/{category}")
    public Mono<ResponseEntity<CategoryPricingResponse>> getCategoryPricing(
            @Parameter(description = "서비스 카테고리", required = true)
            @PathVariable ServiceCategory category) {
        return sessionConfigService.getCategoryPricing(category)
                .map(CategoryPricingResponse::from)
                .map(ResponseEntity::ok);
    }

    @Operation(
            summary = "세션 가격 견적",
            description = "카테고리와 요청 시간(시간 단위)으로 기본/초과 요금을 계산합니다. 초과 시간은 과금 단위로 올림됩니다."
    )
    @GetMapping("/api/v1/pricing/categories/{category}/quote")
    public Mono<ResponseEntity<PricingResult>> quote(
            @PathVariable ServiceCategory category,
            @Parameter(description = "요청 시간 (시간)", example = "5.5")
            @RequestParam double duration) {
        return sessionPricingService.calculateSessionPrice(category, duration)
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "카테고리 요금 수정 (관리자용)")
    @PutMapping("/api/v1/admin/session-config/category-pricing/{category}")
    public Mono<ResponseEntity<CategoryPricingResponse>> updateCategoryPricing(
            @PathVariable ServiceCategory category,
            @Valid @RequestBody CategoryPricingUpdateRequest request) {
        return sessionConfigService.updateCategoryPricing(category, request)
                .map(CategoryPricingResponse::from)
                .map(ResponseEntity::ok);
    }
}
