package com.has.domain.catalog.service;

import com.has.domain.catalog.entity.ServiceCategory;
import com.has.domain.catalog.entity.ServiceListing;
import com.has.domain.catalog.repository.ServiceListingRepository;
import com.has.global.exception.BusinessException;
import com.has.global.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Locale;

@Slf4j
@Service
@RequiredArgsConstructor
public class ServiceCatalogService {

    private final ServiceListingRepository serviceListingRepository;

    // 서비스가 없으면 SERVICE_NOT_FOUND 예외
    public Mono<ServiceListing> findServiceOrThrow(Long serviceId) {
        return serviceListingRepository.findById(serviceId)
                .switchIfEmpty(Mono.error(new BusinessException(ErrorCode.SERVICE_NOT_FOUND)));
    }

    // 배정 요청용 카테고리 일반 서비스 조회, 없으면 생성
    public Mono<ServiceListing> findOrCreateGenericService(ServiceCategory category, String description) {
        return serviceListingRepository.findFirstByCategoryAndProviderIdIsNull(category.name())
                .switchIfEmpty(Mono.defer(() -> {
                    String label = displayName(category);
                    ServiceListing generic = ServiceListing.builder()
                            .title(label + " Service")
                            .description(description != null && !description.isBlank()
                                    ? description
                                    : "Professional " + label.toLowerCase(Locale.ROOT) + " service")
                            .category(category.name())
                            .status("ACTIVE")
                            .isAvailable(true)
                            .createdAt(LocalDateTime.now())
                            .updatedAt(LocalDateTime.now())
                            .build();
                    return serviceListingRepository.save(generic)
                            .doOnSuccess(saved -> log.info("카테고리 일반 서비스 생성: serviceId={}, category={}",
                                    saved.getId(), category));
                }));
    }

    private static String displayName(ServiceCategory category) {
        String lower = category.name().toLowerCase(Locale.ROOT);
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }
}
