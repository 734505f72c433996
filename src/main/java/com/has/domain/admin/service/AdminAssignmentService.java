package com.has.domain.admin.service;

import com.has.domain.admin.dto.AvailableProviderResponse;
import com.has.domain.admin.dto.AvailableProvidersResponse;
import com.has.domain.admin.dto.PendingAssignmentsResponse;
import com.has.domain.availability.service.AvailabilityService;
import com.has.domain.catalog.entity.CameroonProvince;
import com.has.domain.catalog.entity.ServiceCategory;
import com.has.domain.session.dto.SessionListResponse;
import com.has.domain.session.dto.SessionResponse;
import com.has.domain.session.dto.StatusCount;
import com.has.domain.session.entity.Session;
import com.has.domain.session.entity.SessionStatus;
import com.has.domain.session.repository.SessionRepository;
import com.has.domain.session.service.SessionConflictService;
import com.has.domain.session.service.SessionService;
import com.has.domain.user.dto.ProviderCandidate;
import com.has.domain.user.dto.ProviderSearchCondition;
import com.has.domain.user.service.ProviderDirectoryService;
import com.has.global.exception.BusinessException;
import com.has.global.exception.ErrorCode;
import com.has.global.util.GeoUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;

// 관리자 배정 화면: 배정 대기열, 배정 가능 제공자 검색, 배정/거절, 상태 통계
@Slf4j
@Service
@RequiredArgsConstructor
public class AdminAssignmentService {

    // 평점 높은 순, 같으면 가까운 순 (거리 미상은 뒤로)
    private static final Comparator<AvailableProviderResponse> CANDIDATE_ORDER =
            Comparator.comparingDouble((AvailableProviderResponse p) -> p.getAverageRating() != null ? p.getAverageRating() : 0.0)
                    .reversed()
                    .thenComparing(AvailableProviderResponse::getDistance,
                            Comparator.nullsLast(Comparator.<Double>naturalOrder()));

    private final SessionRepository sessionRepository;
    private final SessionService sessionService;
    private final SessionConflictService sessionConflictService;
    private final AvailabilityService availabilityService;
    private final ProviderDirectoryService providerDirectoryService;

    // 오래된 요청부터
    public Mono<PendingAssignmentsResponse> getPendingAssignments(int page, int limit) {
        int safePage = Math.max(page, 1);
        int safeLimit = Math.max(limit, 1);
        String status = SessionStatus.PENDING_ASSIGNMENT.name();
        return Mono.zip(
                        sessionRepository.findByStatusOrderByCreatedAtAsc(status, PageRequest.of(safePage - 1, safeLimit))
                                .map(SessionResponse::from)
                                .collectList(),
                        sessionRepository.countByStatus(status))
                .map(tuple -> PendingAssignmentsResponse.builder()
                        .sessions(tuple.getT1())
                        .pagination(SessionListResponse.Pagination.builder()
                                .page(safePage)
                                .limit(safeLimit)
                                .total(tuple.getT2())
                                .totalPages((int) Math.ceil((double) tuple.getT2() / safeLimit))
                                .build())
                        .build());
    }

    // 카테고리·지역·필터를 만족하고, 해당 시간에 가용하며 충돌이 없는 제공자
    public Mono<AvailableProvidersResponse> findAvailableProviders(Long sessionId, Double minRating, String experienceLevel) {
        return sessionService.findSessionOrThrow(sessionId)
                .flatMap(session -> {
                    if (!SessionStatus.PENDING_ASSIGNMENT.name().equals(session.getStatus())) {
                        return Mono.error(new BusinessException(ErrorCode.SESSION_NOT_PENDING_ASSIGNMENT));
                    }
                    ProviderSearchCondition condition = ProviderSearchCondition.builder()
                            .category(ServiceCategory.valueOf(session.getCategory()))
                            .area(session.getServiceLocation() != null
                                    ? CameroonProvince.valueOf(session.getServiceLocation())
                                    : null)
                            .minRating(minRating)
                            .experienceLevel(experienceLevel)
                            .build();
                    return providerDirectoryService.searchProviders(condition)
                            .concatMap(candidate -> isFree(candidate, session)
                                    .filter(Boolean::booleanValue)
                                    .map(free -> toResponse(candidate, session)))
                            .sort(CANDIDATE_ORDER)
                            .collectList()
                            .map(providers -> AvailableProvidersResponse.builder()
                                    .session(SessionResponse.from(session))
                                    .providers(providers)
                                    .totalFound(providers.size())
                                    .build());
                });
    }

    public Mono<SessionResponse> assignProvider(Long sessionId, Long providerId, Long adminId, String notes) {
        return sessionService.assignProvider(sessionId, providerId, adminId, notes)
                .map(SessionResponse::from);
    }

    public Mono<SessionResponse> rejectServiceRequest(Long sessionId, String reason, String adminNotes, Long adminId) {
        return sessionService.rejectServiceRequest(sessionId, reason, adminNotes, adminId)
                .map(SessionResponse::from);
    }

    // 모든 상태를 0으로 채운 뒤 집계 결과 반영
    public Mono<Map<String, Long>> getAssignmentStats() {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (SessionStatus status : SessionStatus.values()) {
            counts.put(status.name(), 0L);
        }
        return sessionRepository.countGroupByStatus()
                .collectList()
                .map(rows -> {
                    for (StatusCount row : rows) {
                        counts.put(row.getStatus(), row.getCount());
                    }
                    return counts;
                });
    }

    private Mono<Boolean> isFree(ProviderCandidate candidate, Session session) {
        Long providerId = candidate.getUser().getId();
        return availabilityService.isAvailable(providerId, session.getSessionDate(), session.getStartTime(), session.getEndTime())
                .flatMap(available -> {
                    if (!available) {
                        return Mono.just(false);
                    }
                    return sessionConflictService.checkSessionConflict(providerId, session.getSessionDate(),
                                    session.getStartTime(), session.getEndTime(), session.getId())
                            .map(conflict -> !conflict);
                });
    }

    private static AvailableProviderResponse toResponse(ProviderCandidate candidate, Session session) {
        Double distance = null;
        if (candidate.getProfile().getCurrentLatitude() != null && candidate.getProfile().getCurrentLongitude() != null
                && session.getServiceLatitude() != null && session.getServiceLongitude() != null) {
            distance = GeoUtils.distanceMeters(candidate.getProfile().getCurrentLatitude(),
                    candidate.getProfile().getCurrentLongitude(),
                    session.getServiceLatitude(), session.getServiceLongitude());
        }
        return AvailableProviderResponse.builder()
                .id(candidate.getUser().getId())
                .fullName(candidate.getUser().getFullName())
                .email(candidate.getUser().getEmail())
                .phoneNumber(candidate.getUser().getPhoneNumber())
                .experienceLevel(candidate.getProfile().getExperienceLevel())
                .averageRating(candidate.rating())
                .totalReviews(candidate.getProfile().getTotalReviews())
                .distance(distance)
                .build();
    }
}
