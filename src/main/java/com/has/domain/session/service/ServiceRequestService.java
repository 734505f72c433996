package com.has.domain.session.service;

import com.has.domain.catalog.service.ServiceCatalogService;
import com.has.domain.pricing.constants.PricingConstants;
import com.has.domain.pricing.service.SessionPricingService;
import com.has.domain.session.dto.ServiceRequestCreateRequest;
import com.has.domain.session.dto.ServiceRequestResponse;
import com.has.domain.session.entity.PaymentStatus;
import com.has.domain.session.entity.Session;
import com.has.domain.session.entity.SessionStatus;
import com.has.domain.session.repository.SessionRepository;
import com.has.global.exception.BusinessException;
import com.has.global.exception.ErrorCode;
import com.has.global.util.TimeOfDayUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

// 제공자를 고르지 않은 수요자의 서비스 요청. 카테고리 일반 서비스로 PENDING_ASSIGNMENT 세션을 만든다
@Slf4j
@Service
@RequiredArgsConstructor
public class ServiceRequestService {

    private final SessionRepository sessionRepository;
    private final ServiceCatalogService serviceCatalogService;
    private final SessionPricingService sessionPricingService;

    public Mono<ServiceRequestResponse> createServiceRequest(Long seekerId, ServiceRequestCreateRequest request) {
        return Mono.fromCallable(() -> {
                    SessionService.validateDuration(request.getDuration());
                    return TimeOfDayUtils.endTime(request.getStartTime(), request.getDuration());
                })
                .flatMap(endTime -> serviceCatalogService
                        .findOrCreateGenericService(request.getCategory(), request.getDescription())
                        .flatMap(service -> sessionPricingService
                                .calculateSessionPrice(request.getCategory(), request.getDuration())
                                .flatMap(pricing -> {
                                    LocalDateTime now = LocalDateTime.now();
                                    Session session = Session.builder()
                                            .seekerId(seekerId)
                                            .serviceId(service.getId())
                                            .serviceName(service.getTitle())
                                            .category(request.getCategory().name())
                                            .sessionDate(request.getServiceDate())
                                            .startTime(request.getStartTime())
                                            .endTime(endTime)
                                            .duration(request.getDuration())
                                            .currency(PricingConstants.CURRENCY)
                                            .status(SessionStatus.PENDING_ASSIGNMENT.name())
                                            .paymentStatus(PaymentStatus.PENDING.name())
                                            .notes(request.getSpecialInstructions())
                                            .serviceLocation(request.getProvince().name())
                                            .serviceAddress(request.getServiceAddress())
                                            .serviceLatitude(request.getLatitude())
                                            .serviceLongitude(request.getLongitude())
                                            .createdAt(now)
                                            .updatedAt(now)
                                            .build();
                                    SessionService.applyPricing(session, pricing);
                                    return sessionRepository.save(session);
                                })))
                .map(ServiceRequestResponse::from)
                .doOnSuccess(res -> log.info("서비스 요청 생성: requestId={}, seekerId={}, category={}, estimatedCost={}",
                        res.getRequestId(), seekerId, res.getCategory(), res.getEstimatedCost()));
    }

    public Flux<ServiceRequestResponse> getUserServiceRequests(Long seekerId) {
        return sessionRepository.findServiceRequestsBySeekerId(seekerId)
                .map(ServiceRequestResponse::from);
    }

    // 본인 요청만 조회 가능
    public Mono<ServiceRequestResponse> getServiceRequestStatus(Long requestId, Long seekerId) {
        return sessionRepository.findById(requestId)
                .switchIfEmpty(Mono.error(new BusinessException(ErrorCode.SESSION_NOT_FOUND)))
                .filter(session -> session.getSeekerId().equals(seekerId))
                .switchIfEmpty(Mono.error(new BusinessException(ErrorCode.FORBIDDEN)))
                .map(ServiceRequestResponse::from);
    }
}
