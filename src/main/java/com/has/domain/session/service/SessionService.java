package com.has.domain.session.service;

import com.has.domain.availability.service.AvailabilityService;
import com.has.domain.catalog.entity.CameroonProvince;
import com.has.domain.catalog.entity.ServiceCategory;
import com.has.domain.catalog.entity.ServiceListing;
import com.has.domain.catalog.service.ServiceCatalogService;
import com.has.domain.pricing.constants.PricingConstants;
import com.has.domain.pricing.dto.PricingResult;
import com.has.domain.pricing.service.SessionPricingService;
import com.has.domain.session.config.SessionProperties;
import com.has.domain.session.dto.*;
import com.has.domain.session.entity.PaymentStatus;
import com.has.domain.session.entity.Session;
import com.has.domain.session.entity.SessionStatus;
import com.has.domain.session.event.SessionCompletedEvent;
import com.has.domain.session.event.SessionEventProducer;
import com.has.domain.session.repository.SessionQueryRepository;
import com.has.domain.session.repository.SessionRepository;
import com.has.domain.user.entity.UserRole;
import com.has.domain.user.service.ProviderDirectoryService;
import com.has.global.exception.BusinessException;
import com.has.global.exception.ErrorCode;
import com.has.global.util.TimeOfDayUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 세션 생성부터 완료까지의 상태 전이를 담당.
 * 모든 상태 변경은 SessionStatus.canTransitionTo 검증 후 조건부 UPDATE로 반영하며,
 * COMPLETED 전이가 성공한 경우에만 session-completed 이벤트를 발행한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionService {

    private static final double MIN_DURATION_HOURS = 0.5;
    private static final double MAX_DURATION_HOURS = 12;

    private final SessionRepository sessionRepository;
    private final SessionQueryRepository sessionQueryRepository;
    private final SessionConflictService sessionConflictService;
    private final ScheduleLockService scheduleLockService;
    private final SessionEventProducer sessionEventProducer;
    private final SessionPricingService sessionPricingService;
    private final AvailabilityService availabilityService;
    private final ServiceCatalogService serviceCatalogService;
    private final ProviderDirectoryService providerDirectoryService;
    private final SessionProperties sessionProperties;

    // ============ 생성 ============

    public Mono<Session> createSession(Long seekerId, SessionCreateRequest request) {
        return Mono.fromCallable(() -> {
                    validateDuration(request.getDuration());
                    return TimeOfDayUtils.endTime(request.getStartTime(), request.getDuration());
                })
                .flatMap(endTime -> serviceCatalogService.findServiceOrThrow(request.getServiceId())
                        .flatMap(service -> {
                            if (!"ACTIVE".equals(service.getStatus()) || !Boolean.TRUE.equals(service.getIsAvailable())) {
                                return Mono.error(new BusinessException(ErrorCode.SERVICE_UNAVAILABLE));
                            }
                            ServiceCategory category = ServiceCategory.valueOf(service.getCategory());
                            return sessionPricingService.calculateSessionPrice(category, request.getDuration())
                                    .flatMap(pricing -> scheduleLockService.withScheduleLock(
                                            service.getProviderId(), request.getSessionDate(),
                                            () -> verifySchedule(service.getProviderId(), request.getSessionDate(),
                                                    request.getStartTime(), endTime, null)
                                                    .then(Mono.defer(() -> sessionRepository.save(
                                                            newSession(seekerId, service, request, endTime, pricing))))));
                        }))
                .doOnSuccess(saved -> log.info("세션 생성: sessionId={}, seekerId={}, serviceId={}, status={}, total={}",
                        saved.getId(), seekerId, saved.getServiceId(), saved.getStatus(), saved.getTotalAmount()));
    }

    private Session newSession(Long seekerId, ServiceListing service, SessionCreateRequest request,
                               String endTime, PricingResult pricing) {
        // 관리자 배정 정책이거나 제공자가 없는 일반 서비스면 배정 대기
        boolean awaitAssignment = sessionProperties.isRequireAdminAssignment() || service.getProviderId() == null;
        LocalDateTime now = LocalDateTime.now();
        Session session = Session.builder()
                .seekerId(seekerId)
                .providerId(awaitAssignment ? null : service.getProviderId())
                .serviceId(service.getId())
                .serviceName(service.getTitle())
                .category(service.getCategory())
                .sessionDate(request.getSessionDate())
                .startTime(request.getStartTime())
                .endTime(endTime)
                .duration(request.getDuration())
                .currency(PricingConstants.CURRENCY)
                .status(awaitAssignment ? SessionStatus.PENDING_ASSIGNMENT.name() : SessionStatus.PENDING.name())
                .paymentStatus(PaymentStatus.PENDING.name())
                .notes(request.getNotes())
                .serviceLocation(request.getServiceLocation() != null ? request.getServiceLocation().name() : null)
                .serviceAddress(request.getServiceAddress())
                .serviceLatitude(request.getServiceLatitude())
                .serviceLongitude(request.getServiceLongitude())
                .createdAt(now)
                .updatedAt(now)
                .build();
        applyPricing(session, pricing);
        return session;
    }

    // ============ 관리자 배정 / 거절 ============

    public Mono<Session> assignProvider(Long sessionId, Long providerId, Long adminId, String notes) {
        return findSessionOrThrow(sessionId)
                .flatMap(session -> {
                    if (!SessionStatus.PENDING_ASSIGNMENT.name().equals(session.getStatus()) || session.getProviderId() != null) {
                        return Mono.error(new BusinessException(ErrorCode.SESSION_NOT_PENDING_ASSIGNMENT));
                    }
                    ServiceCategory category = ServiceCategory.valueOf(session.getCategory());
                    CameroonProvince area = session.getServiceLocation() != null
                            ? CameroonProvince.valueOf(session.getServiceLocation())
                            : null;
                    return providerDirectoryService.validateAssignable(providerId, category, area)
                            .thenReturn(session);
                })
                .flatMap(session -> scheduleLockService.withScheduleLock(providerId, session.getSessionDate(),
                        () -> verifySchedule(providerId, session.getSessionDate(), session.getStartTime(),
                                session.getEndTime(), session.getId())
                                .then(Mono.defer(() -> {
                                    session.setProviderId(providerId);
                                    session.setAssignedBy(adminId);
                                    session.setAssignedAt(LocalDateTime.now());
                                    session.setAssignmentNotes(notes);
                                    SessionStatus next = sessionProperties.isAutoConfirmOnAssignment()
                                            ? SessionStatus.CONFIRMED
                                            : SessionStatus.ASSIGNED;
                                    return transition(session, next);
                                }))))
                .doOnSuccess(saved -> log.info("제공자 배정: sessionId={}, providerId={}, adminId={}, status={}",
                        sessionId, providerId, adminId, saved.getStatus()));
    }

    public Mono<Session> rejectServiceRequest(Long sessionId, String reason, String adminNotes, Long adminId) {
        return findSessionOrThrow(sessionId)
                .flatMap(session -> {
                    if (!SessionStatus.PENDING_ASSIGNMENT.name().equals(session.getStatus())) {
                        return Mono.error(new BusinessException(ErrorCode.SESSION_NOT_PENDING_ASSIGNMENT));
                    }
                    session.setRejectionReason(reason);
                    session.setRejectedBy(adminId);
                    session.setRejectedAt(LocalDateTime.now());
                    session.setAssignmentNotes(adminNotes);
                    return transition(session, SessionStatus.REJECTED);
                })
                .doOnSuccess(saved -> log.info("서비스 요청 거절: sessionId={}, adminId={}, reason={}",
                        sessionId, adminId, reason));
    }

    // ============ 제공자 확인 / 거절 ============

    public Mono<Session> confirmSession(Long sessionId, Long userId, UserRole role) {
        return findSessionOrThrow(sessionId)
                .flatMap(session -> requireAssignedProviderOrAdmin(session, userId, role))
                .flatMap(session -> {
                    requireStatus(session, SessionStatus.ASSIGNED, SessionStatus.PENDING);
                    return transition(session, SessionStatus.CONFIRMED);
                })
                .doOnSuccess(saved -> log.info("세션 확정: sessionId={}, userId={}", sessionId, userId));
    }

    public Mono<Session> rejectAssignment(Long sessionId, Long userId, UserRole role, String reason) {
        return findSessionOrThrow(sessionId)
                .flatMap(session -> requireAssignedProviderOrAdmin(session, userId, role))
                .flatMap(session -> {
                    requireStatus(session, SessionStatus.ASSIGNED, SessionStatus.PENDING);
                    session.setRejectionReason(reason);
                    session.setRejectedBy(userId);
                    session.setRejectedAt(LocalDateTime.now());
                    if (SessionStatus.ASSIGNED.name().equals(session.getStatus())
                            && sessionProperties.isReturnToPoolOnProviderRejection()) {
                        // 재배정을 위해 배정 정보 초기화
                        session.setProviderId(null);
                        session.setAssignedBy(null);
                        session.setAssignedAt(null);
                        return transition(session, SessionStatus.PENDING_ASSIGNMENT);
                    }
                    return transition(session, SessionStatus.REJECTED);
                })
                .doOnSuccess(saved -> log.info("배정 거절: sessionId={}, userId={}, status={}",
                        sessionId, userId, saved.getStatus()));
    }

    // ============ 수정 / 취소 ============

    public Mono<Session> updateSession(Long sessionId, SessionUpdateRequest request, Long userId, UserRole role) {
        return findSessionOrThrow(sessionId)
                .flatMap(session -> {
                    if (role != UserRole.ADMIN && !session.isParticipant(userId)) {
                        return Mono.error(new BusinessException(ErrorCode.FORBIDDEN));
                    }
                    return applyUpdate(session, request);
                });
    }

    public Mono<Session> cancelSession(Long sessionId, Long userId, String reason) {
        return findSessionOrThrow(sessionId)
                .flatMap(session -> {
                    if (!session.isParticipant(userId)) {
                        return Mono.error(new BusinessException(ErrorCode.FORBIDDEN));
                    }
                    if (SessionStatus.COMPLETED.name().equals(session.getStatus())) {
                        return Mono.error(new BusinessException(ErrorCode.SESSION_COMPLETED));
                    }
                    if (session.statusEnum().isTerminal()) {
                        return Mono.error(new BusinessException(ErrorCode.INVALID_STATUS_TRANSITION,
                                "이미 종료된 세션입니다: " + session.getStatus()));
                    }
                    SessionUpdateRequest cancel = new SessionUpdateRequest();
                    cancel.setStatus(SessionStatus.CANCELLED);
                    cancel.setCancellationReason(reason);
                    return applyUpdate(session, cancel);
                })
                .doOnSuccess(saved -> log.info("세션 취소: sessionId={}, userId={}, paymentStatus={}",
                        sessionId, userId, saved.getPaymentStatus()));
    }

    private Mono<Session> applyUpdate(Session session, SessionUpdateRequest request) {
        SessionStatus current = session.statusEnum();
        SessionStatus next = request.getStatus() != null && request.getStatus() != current ? request.getStatus() : null;

        if (next != null && !current.canTransitionTo(next)) {
            return Mono.error(new BusinessException(ErrorCode.INVALID_STATUS_TRANSITION,
                    "상태 전이 불가: " + current + " -> " + next));
        }
        if (next != null && !SessionStatus.PATCHABLE_TARGETS.contains(next)) {
            return Mono.error(new BusinessException(ErrorCode.INVALID_STATUS_TRANSITION,
                    next + " 상태는 배정/확정/거절 API로만 변경할 수 있습니다"));
        }
        if (next != null && next != SessionStatus.CANCELLED && session.getProviderId() == null) {
            return Mono.error(new BusinessException(ErrorCode.PROVIDER_NOT_ASSIGNED));
        }
        SessionStatus target = next != null ? next : current;
        if (request.getPaymentStatus() == PaymentStatus.PAID
                && (target == SessionStatus.CANCELLED || target == SessionStatus.REJECTED)) {
            return Mono.error(new BusinessException(ErrorCode.PAYMENT_NOT_ALLOWED));
        }
        if (request.changesSchedule() && !SessionStatus.RESCHEDULABLE_STATUSES.contains(current)) {
            return Mono.error(new BusinessException(ErrorCode.RESCHEDULE_NOT_ALLOWED));
        }

        if (request.getNotes() != null) {
            session.setNotes(request.getNotes());
        }
        if (request.getPaymentStatus() != null) {
            session.setPaymentStatus(request.getPaymentStatus().name());
        }
        if (request.getCancellationReason() != null) {
            session.setCancellationReason(request.getCancellationReason());
        }

        if (!request.changesSchedule()) {
            return persist(session, next);
        }
        return reschedule(session, request, next);
    }

    // 날짜/시작 시각/시간 변경: 종료 시각·가격 재계산 후 자기 자신을 제외하고 가용성·충돌 재검사
    private Mono<Session> reschedule(Session session, SessionUpdateRequest request, SessionStatus next) {
        LocalDate date = request.getSessionDate() != null ? request.getSessionDate() : session.getSessionDate();
        String startTime = request.getStartTime() != null ? request.getStartTime() : session.getStartTime();
        double duration = request.getDuration() != null ? request.getDuration() : session.getDuration();

        return Mono.fromCallable(() -> {
                    validateDuration(duration);
                    return TimeOfDayUtils.endTime(startTime, duration);
                })
                .flatMap(endTime -> sessionPricingService
                        .calculateSessionPrice(ServiceCategory.valueOf(session.getCategory()), duration)
                        .flatMap(pricing -> scheduleLockService.withScheduleLock(session.getProviderId(), date,
                                () -> verifySchedule(session.getProviderId(), date, startTime, endTime, session.getId())
                                        .then(Mono.defer(() -> {
                                            session.setSessionDate(date);
                                            session.setStartTime(startTime);
                                            session.setEndTime(endTime);
                                            session.setDuration(duration);
                                            applyPricing(session, pricing);
                                            return persist(session, next);
                                        })))))
                .doOnSuccess(saved -> log.info("세션 일정 변경: sessionId={}, date={}, {}-{}, total={}",
                        saved.getId(), saved.getSessionDate(), saved.getStartTime(), saved.getEndTime(),
                        saved.getTotalAmount()));
    }

    private Mono<Session> persist(Session session, SessionStatus next) {
        if (next == null) {
            session.setUpdatedAt(LocalDateTime.now());
            return sessionRepository.save(session);
        }
        return transition(session, next);
    }

    // ============ 위치 추적 연동 ============

    // 위치 추적 시작 시 CONFIRMED -> IN_PROGRESS. 이미 진행 중이면 그대로 둔다
    public Mono<Session> startSession(Session session) {
        if (SessionStatus.CONFIRMED.name().equals(session.getStatus())) {
            return transition(session, SessionStatus.IN_PROGRESS);
        }
        return Mono.just(session);
    }

    // 서비스 완료 보고 시 IN_PROGRESS -> COMPLETED. 이미 완료된 세션은 이벤트 없이 그대로 반환
    public Mono<Session> completeSession(Long sessionId) {
        return findSessionOrThrow(sessionId)
                .flatMap(session -> {
                    if (SessionStatus.COMPLETED.name().equals(session.getStatus())) {
                        log.info("이미 완료된 세션: sessionId={}", sessionId);
                        return Mono.just(session);
                    }
                    return transition(session, SessionStatus.COMPLETED);
                });
    }

    // ============ 조회 ============

    public Mono<Session> findSessionOrThrow(Long sessionId) {
        return sessionRepository.findById(sessionId)
                .switchIfEmpty(Mono.error(new BusinessException(ErrorCode.SESSION_NOT_FOUND)));
    }

    public Mono<Session> findOne(Long sessionId, Long userId, UserRole role) {
        return findSessionOrThrow(sessionId)
                .flatMap(session -> role == UserRole.ADMIN || session.isParticipant(userId)
                        ? Mono.just(session)
                        : Mono.error(new BusinessException(ErrorCode.FORBIDDEN)));
    }

    public Mono<SessionListResponse> findBySeeker(Long seekerId, SessionStatus status, int page, int limit) {
        Pageable pageable = pageRequest(page, limit);
        Flux<Session> sessions = status != null
                ? sessionRepository.findBySeekerIdAndStatusOrderByCreatedAtDesc(seekerId, status.name(), pageable)
                : sessionRepository.findBySeekerIdOrderByCreatedAtDesc(seekerId, pageable);
        Mono<Long> total = status != null
                ? sessionRepository.countBySeekerIdAndStatus(seekerId, status.name())
                : sessionRepository.countBySeekerId(seekerId);
        return toListResponse(sessions, total, sessionQueryRepository.aggregateBySeeker(seekerId), page, limit, false);
    }

    public Mono<SessionListResponse> findByProvider(Long providerId, SessionStatus status, int page, int limit) {
        Pageable pageable = pageRequest(page, limit);
        Flux<Session> sessions = status != null
                ? sessionRepository.findByProviderIdAndStatusOrderBySessionDateDesc(providerId, status.name(), pageable)
                : sessionRepository.findByProviderIdOrderBySessionDateDesc(providerId, pageable);
        Mono<Long> total = status != null
                ? sessionRepository.countByProviderIdAndStatus(providerId, status.name())
                : sessionRepository.countByProviderId(providerId);
        return toListResponse(sessions, total, sessionQueryRepository.aggregateByProvider(providerId), page, limit, true);
    }

    public Flux<Session> findAll(int page, int limit) {
        Pageable pageable = pageRequest(page, limit);
        return sessionRepository.findPage(pageable.getPageSize(), pageable.getOffset());
    }

    private Mono<SessionListResponse> toListResponse(Flux<Session> sessions, Mono<Long> total,
                                                     Flux<StatusAggregate> aggregates, int page, int limit,
                                                     boolean includeEarnings) {
        return Mono.zip(sessions.map(SessionResponse::from).collectList(), total, aggregates.collectList())
                .map(tuple -> {
                    List<StatusAggregate> rows = tuple.getT3();
                    Map<String, Long> counts = new LinkedHashMap<>();
                    for (SessionStatus s : SessionStatus.values()) {
                        counts.put(s.name(), 0L);
                    }
                    long totalSessions = 0;
                    long earnings = 0;
                    for (StatusAggregate row : rows) {
                        counts.put(row.getStatus(), row.getCount());
                        totalSessions += row.getCount();
                        if (SessionStatus.COMPLETED.name().equals(row.getStatus())) {
                            earnings = row.getTotalAmount();
                        }
                    }
                    int safeLimit = Math.max(limit, 1);
                    return SessionListResponse.builder()
                            .sessions(tuple.getT1())
                            .pagination(SessionListResponse.Pagination.builder()
                                    .page(page)
                                    .limit(safeLimit)
                                    .total(tuple.getT2())
                                    .totalPages((int) Math.ceil((double) tuple.getT2() / safeLimit))
                                    .build())
                            .summary(SessionListResponse.Summary.builder()
                                    .totalSessions(totalSessions)
                                    .statusCounts(counts)
                                    .totalEarnings(includeEarnings ? earnings : null)
                                    .build())
                            .build();
                });
    }

    // ============ 리뷰 ============

    public Mono<Session> addReview(Long sessionId, Long userId, ReviewRequest request) {
        if (request.getRating() == null || request.getRating() < 1 || request.getRating() > 5) {
            return Mono.error(new BusinessException(ErrorCode.INVALID_RATING));
        }
        return findSessionOrThrow(sessionId)
                .flatMap(session -> {
                    if (!SessionStatus.COMPLETED.name().equals(session.getStatus())) {
                        return Mono.error(new BusinessException(ErrorCode.REVIEW_NOT_ALLOWED));
                    }
                    if (userId.equals(session.getSeekerId())) {
                        session.setSeekerRating(request.getRating());
                        session.setSeekerReview(request.getReview());
                        session.setUpdatedAt(LocalDateTime.now());
                        // 수요자 평점은 제공자 평균 평점에 반영
                        return sessionRepository.save(session)
                                .flatMap(saved -> sessionQueryRepository.ratingSummaryByProvider(saved.getProviderId())
                                        .flatMap(summary -> providerDirectoryService.updateRating(saved.getProviderId(),
                                                summary.getAverageRating(), summary.getTotalReviews()))
                                        .thenReturn(saved));
                    }
                    if (userId.equals(session.getProviderId())) {
                        session.setProviderRating(request.getRating());
                        session.setProviderReview(request.getReview());
                        session.setUpdatedAt(LocalDateTime.now());
                        return sessionRepository.save(session);
                    }
                    return Mono.error(new BusinessException(ErrorCode.FORBIDDEN));
                })
                .doOnSuccess(saved -> log.info("리뷰 등록: sessionId={}, userId={}, rating={}",
                        sessionId, userId, request.getRating()));
    }

    // ============ 내부 ============

    // 상태 전이: 검증 후 현재 상태 조건부 UPDATE. 동시에 다른 요청이 먼저 바꿨으면 실패
    private Mono<Session> transition(Session session, SessionStatus next) {
        SessionStatus current = session.statusEnum();
        if (!current.canTransitionTo(next)) {
            return Mono.error(new BusinessException(ErrorCode.INVALID_STATUS_TRANSITION,
                    "상태 전이 불가: " + current + " -> " + next));
        }
        if (session.getProviderId() == null && !SessionStatus.PROVIDERLESS_STATUSES.contains(next)) {
            return Mono.error(new BusinessException(ErrorCode.PROVIDER_NOT_ASSIGNED));
        }
        if (next == SessionStatus.CANCELLED && PaymentStatus.PAID.name().equals(session.getPaymentStatus())) {
            session.setPaymentStatus(PaymentStatus.REFUNDED.name());
        }
        LocalDateTime now = LocalDateTime.now();
        return sessionRepository.updateStatusIfCurrent(session.getId(), current.name(), next.name(), now)
                .flatMap(updated -> {
                    if (updated == 0) {
                        return Mono.error(new BusinessException(ErrorCode.INVALID_STATUS_TRANSITION,
                                "다른 요청에서 세션 상태가 이미 변경되었습니다"));
                    }
                    session.setStatus(next.name());
                    session.setUpdatedAt(now);
                    return sessionRepository.save(session);
                })
                .flatMap(saved -> next == SessionStatus.COMPLETED
                        ? publishCompleted(saved).thenReturn(saved)
                        : Mono.just(saved))
                .doOnSuccess(saved -> log.info("세션 상태 변경: sessionId={}, {} -> {}", saved.getId(), current, next));
    }

    private Mono<Void> publishCompleted(Session session) {
        if (PaymentStatus.REFUNDED.name().equals(session.getPaymentStatus())) {
            log.warn("환불된 세션은 정산하지 않음: sessionId={}", session.getId());
            return Mono.empty();
        }
        return sessionEventProducer.sendSessionCompletedEvent(SessionCompletedEvent.builder()
                .sessionId(session.getId())
                .providerId(session.getProviderId())
                .amount(session.getTotalAmount())
                .build());
    }

    // 가용성 먼저, 충돌 다음. 제공자가 없으면 검사하지 않는다
    private Mono<Void> verifySchedule(Long providerId, LocalDate date, String startTime, String endTime,
                                      Long excludeSessionId) {
        if (providerId == null) {
            return Mono.empty();
        }
        return availabilityService.isAvailable(providerId, date, startTime, endTime)
                .flatMap(available -> {
                    if (!available) {
                        return Mono.error(new BusinessException(ErrorCode.PROVIDER_UNAVAILABLE));
                    }
                    return sessionConflictService.checkSessionConflict(providerId, date, startTime, endTime,
                            excludeSessionId);
                })
                .flatMap(conflict -> {
                    if (conflict) {
                        return Mono.error(new BusinessException(ErrorCode.SCHEDULE_CONFLICT));
                    }
                    return Mono.<Void>empty();
                })
                .then();
    }

    private Mono<Session> requireAssignedProviderOrAdmin(Session session, Long userId, UserRole role) {
        if (role == UserRole.ADMIN || (session.getProviderId() != null && session.getProviderId().equals(userId))) {
            return Mono.just(session);
        }
        return Mono.error(new BusinessException(ErrorCode.FORBIDDEN));
    }

    private static void requireStatus(Session session, SessionStatus... allowed) {
        for (SessionStatus status : allowed) {
            if (status.name().equals(session.getStatus())) {
                return;
            }
        }
        throw new BusinessException(ErrorCode.INVALID_STATUS_TRANSITION,
                "현재 상태에서 처리할 수 없습니다: " + session.getStatus());
    }

    static void validateDuration(Double duration) {
        if (duration == null || duration < MIN_DURATION_HOURS || duration > MAX_DURATION_HOURS) {
            throw new BusinessException(ErrorCode.INVALID_DURATION);
        }
    }

    static void applyPricing(Session session, PricingResult pricing) {
        session.setBaseDuration(pricing.getBaseDuration());
        session.setOvertimeHours(pricing.getOvertimeHours());
        session.setBasePrice(pricing.getBasePrice());
        session.setOvertimePrice(pricing.getOvertimePrice());
        session.setTotalAmount(pricing.getTotalPrice());
    }

    private static Pageable pageRequest(int page, int limit) {
        return PageRequest.of(Math.max(page, 1) - 1, Math.max(limit, 1));
    }
}
