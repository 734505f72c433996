package com.has.domain.pricing.service;

import com.has.domain.catalog.entity.ServiceCategory;
import com.has.domain.pricing.dto.CategoryPricingUpdateRequest;
import com.has.domain.pricing.entity.CategoryPricing;
import com.has.domain.pricing.entity.SessionConfig;
import com.has.domain.pricing.repository.CategoryPricingRepository;
import com.has.domain.pricing.repository.SessionConfigRepository;
import com.has.global.exception.BusinessException;
import com.has.global.exception.ErrorCode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class SessionConfigServiceTest {

    @Mock
    private SessionConfigRepository sessionConfigRepository;

    @Mock
    private CategoryPricingRepository categoryPricingRepository;

    @InjectMocks
    private SessionConfigService sessionConfigService;

    @Test
    void getActiveConfig_NoConfig_CreatesDefaultWithAllCategories() {
        // Arrange
        when(sessionConfigRepository.findFirstByIsActiveTrue()).thenReturn(Mono.empty());
        when(sessionConfigRepository.save(any(SessionConfig.class))).thenAnswer(invocation -> {
            SessionConfig config = invocation.getArgument(0);
            config.setId(1L);
            return Mono.just(config);
        });
        when(categoryPricingRepository.save(any(CategoryPricing.class)))
                .thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));

        // Act & Assert
        StepVerifier.create(sessionConfigService.getActiveConfig())
                .assertNext(config -> {
                    assertEquals(1L, config.getId());
                    assertTrue(config.getIsActive());
                    assertEquals(4.0, config.getDefaultSessionDuration());
                    assertEquals("FCFA", config.getCurrency());
                })
                .verifyComplete();

        verify(categoryPricingRepository, times(ServiceCategory.values().length)).save(any(CategoryPricing.class));
    }

    @Test
    void getActiveConfig_Existing_DoesNotCreate() {
        SessionConfig existing = SessionConfig.builder().id(7L).isActive(true).build();
        when(sessionConfigRepository.findFirstByIsActiveTrue()).thenReturn(Mono.just(existing));

        StepVerifier.create(sessionConfigService.getActiveConfig())
                .expectNext(existing)
                .verifyComplete();

        verify(sessionConfigRepository, never()).save(any());
    }

    @Test
    void updateCategoryPricing_MissingCategory_ThrowsNotFound() {
        SessionConfig existing = SessionConfig.builder().id(7L).isActive(true).build();
        when(sessionConfigRepository.findFirstByIsActiveTrue()).thenReturn(Mono.just(existing));
        when(categoryPricingRepository.findByConfigIdAndCategory(7L, "PLUMBING")).thenReturn(Mono.empty());

        StepVerifier.create(sessionConfigService.updateCategoryPricing(ServiceCategory.PLUMBING,
                        new CategoryPricingUpdateRequest()))
                .expectErrorSatisfies(e -> assertEquals(ErrorCode.CATEGORY_PRICING_NOT_FOUND,
                        ((BusinessException) e).getErrorCode()))
                .verify();
    }

    @Test
    void updateCategoryPricing_PartialUpdate_KeepsOtherFields() {
        SessionConfig existing = SessionConfig.builder().id(7L).isActive(true).build();
        CategoryPricing pricing = CategoryPricing.builder()
                .id(3L).configId(7L).category("CLEANING")
                .baseSessionPrice(3000).baseSessionDuration(4.0).overtimeRate(375).overtimeIncrement(30)
                .build();
        when(sessionConfigRepository.findFirstByIsActiveTrue()).thenReturn(Mono.just(existing));
        when(categoryPricingRepository.findByConfigIdAndCategory(7L, "CLEANING")).thenReturn(Mono.just(pricing));
        when(categoryPricingRepository.save(any(CategoryPricing.class)))
                .thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));

        CategoryPricingUpdateRequest request = new CategoryPricingUpdateRequest();
        request.setOvertimeRate(500);

        StepVerifier.create(sessionConfigService.updateCategoryPricing(ServiceCategory.CLEANING, request))
                .assertNext(saved -> {
                    assertEquals(500, saved.getOvertimeRate());
                    assertEquals(3000, saved.getBaseSessionPrice());
                    assertEquals(30, saved.getOvertimeIncrement());
                })
                .verifyComplete();
    }
}
