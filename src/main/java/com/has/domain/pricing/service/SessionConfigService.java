package com.has.domain.pricing.service;

import com.has.domain.catalog.entity.ServiceCategory;
import com.has.domain.pricing.constants.PricingConstants;
import com.has.domain.pricing.dto.CategoryPricingResponse;
import com.has.domain.pricing.dto.CategoryPricingUpdateRequest;
import com.has.domain.pricing.dto.SessionConfigResponse;
import com.has.domain.pricing.entity.CategoryPricing;
import com.has.domain.pricing.entity.SessionConfig;
import com.has.domain.pricing.repository.CategoryPricingRepository;
import com.has.domain.pricing.repository.SessionConfigRepository;
import com.has.global.exception.BusinessException;
import com.has.global.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

// 활성 세션 설정(카테고리별 요금) 관리. 요금 계산 시 매번 조회하므로 관리자 변경이 바로 반영된다.
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionConfigService implements CategoryPricingProvider {

    private final SessionConfigRepository sessionConfigRepository;
    private final CategoryPricingRepository categoryPricingRepository;

    // 활성 설정 조회. 없으면 기본 설정 생성
    public Mono<SessionConfig> getActiveConfig() {
        return sessionConfigRepository.findFirstByIsActiveTrue()
                .switchIfEmpty(Mono.defer(this::createDefaultConfig));
    }

    @Override
    public Mono<CategoryPricing> getCategoryPricing(ServiceCategory category) {
        return getActiveConfig()
                .flatMap(config -> categoryPricingRepository.findByConfigIdAndCategory(config.getId(), category.name()))
                .switchIfEmpty(Mono.error(new BusinessException(ErrorCode.CATEGORY_PRICING_NOT_FOUND,
                        "카테고리 요금 설정을 찾을 수 없습니다: " + category)));
    }

    public Flux<CategoryPricing> getAllCategoryPricing() {
        return getActiveConfig()
                .flatMapMany(config -> categoryPricingRepository.findByConfigIdOrderByCategory(config.getId()));
    }

    public Mono<SessionConfigResponse> getActiveConfigView() {
        return getActiveConfig()
                .flatMap(config -> categoryPricingRepository.findByConfigIdOrderByCategory(config.getId())
                        .map(CategoryPricingResponse::from)
                        .collectList()
                        .map(pricing -> SessionConfigResponse.builder()
                                .id(config.getId())
                                .defaultSessionDuration(config.getDefaultSessionDuration())
                                .defaultOvertimeIncrement(config.getDefaultOvertimeIncrement())
                                .currency(config.getCurrency())
                                .notes(config.getNotes())
                                .categoryPricing(pricing)
                                .build()));
    }

    // 카테고리 요금 부분 수정 (관리자)
    public Mono<CategoryPricing> updateCategoryPricing(ServiceCategory category, CategoryPricingUpdateRequest request) {
        return getCategoryPricing(category)
                .flatMap(pricing -> {
                    if (request.getBaseSessionPrice() != null) {
                        pricing.setBaseSessionPrice(request.getBaseSessionPrice());
                    }
                    if (request.getBaseSessionDuration() != null) {
                        pricing.setBaseSessionDuration(request.getBaseSessionDuration());
                    }
                    if (request.getOvertimeRate() != null) {
                        pricing.setOvertimeRate(request.getOvertimeRate());
                    }
                    if (request.getOvertimeIncrement() != null) {
                        pricing.setOvertimeIncrement(request.getOvertimeIncrement());
                    }
                    pricing.setUpdatedAt(LocalDateTime.now());
                    return categoryPricingRepository.save(pricing);
                })
                .doOnSuccess(saved -> log.info("카테고리 요금 변경: category={}, basePrice={}, baseDuration={}, overtimeRate={}, increment={}",
                        category, saved.getBaseSessionPrice(), saved.getBaseSessionDuration(),
                        saved.getOvertimeRate(), saved.getOvertimeIncrement()));
    }

    // 기본 설정 생성: 모든 카테고리 4시간 3,000 FCFA, 30분당 375 FCFA
    private Mono<SessionConfig> createDefaultConfig() {
        SessionConfig config = SessionConfig.builder()
                .defaultSessionDuration(PricingConstants.DEFAULT_BASE_SESSION_DURATION_HOURS)
                .defaultOvertimeIncrement(PricingConstants.DEFAULT_OVERTIME_INCREMENT_MINUTES)
                .currency(PricingConstants.CURRENCY)
                .isActive(true)
                .notes(PricingConstants.DEFAULT_CONFIG_NOTES)
                .createdAt(LocalDateTime.now())
                .updatedAt(LocalDateTime.now())
                .build();

        return sessionConfigRepository.save(config)
                .flatMap(saved -> Flux.fromArray(ServiceCategory.values())
                        .concatMap(category -> categoryPricingRepository.save(defaultPricing(saved.getId(), category)))
                        .then(Mono.just(saved)))
                .doOnSuccess(saved -> log.info("기본 세션 설정 생성: configId={}", saved.getId()))
                // 동시 최초 접근으로 다른 요청이 먼저 생성한 경우 그 설정을 사용
                .onErrorResume(DataIntegrityViolationException.class, e -> {
                    log.warn("기본 세션 설정 동시 생성 감지, 기존 설정 재조회: {}", e.getMessage());
                    return sessionConfigRepository.findFirstByIsActiveTrue();
                });
    }

    private static CategoryPricing defaultPricing(Long configId, ServiceCategory category) {
        return CategoryPricing.builder()
                .configId(configId)
                .category(category.name())
                .baseSessionPrice(PricingConstants.DEFAULT_BASE_SESSION_PRICE)
                .baseSessionDuration(PricingConstants.DEFAULT_BASE_SESSION_DURATION_HOURS)
                .overtimeRate(PricingConstants.DEFAULT_OVERTIME_RATE)
                .overtimeIncrement(PricingConstants.DEFAULT_OVERTIME_INCREMENT_MINUTES)
                .updatedAt(LocalDateTime.now())
                .build();
    }
}
