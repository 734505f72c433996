package com.has.domain.tracking.service;

import com.has.domain.session.entity.Session;
import com.has.domain.session.entity.SessionStatus;
import com.has.domain.session.service.SessionService;
import com.has.domain.tracking.dto.LocationUpdateRequest;
import com.has.domain.tracking.dto.SeekerTrackingResponse;
import com.has.domain.tracking.dto.StartTrackingRequest;
import com.has.domain.tracking.dto.TrackingResponse;
import com.has.domain.tracking.entity.LocationStatus;
import com.has.domain.tracking.entity.LocationTracking;
import com.has.domain.tracking.repository.LocationTrackingRepository;
import com.has.domain.user.entity.UserRole;
import com.has.domain.user.service.ProviderDirectoryService;
import com.has.global.exception.BusinessException;
import com.has.global.exception.ErrorCode;
import com.has.global.util.GeoUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

/**
 * 확정/진행 중 세션의 제공자 위치 추적.
 * 위치 상태는 ON_ROUTE -> AT_LOCATION -> SERVICE_COMPLETE 로만 진행하고,
 * 서비스 완료 시 세션을 COMPLETED로 전이시켜 정산 이벤트가 발행되게 한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LocationTrackingService {

    private final LocationTrackingRepository locationTrackingRepository;
    private final SessionService sessionService;
    private final ProviderDirectoryService providerDirectoryService;
    private final ProximityPolicy proximityPolicy;

    public Mono<TrackingResponse> startTracking(StartTrackingRequest request, Long userId, UserRole role) {
        return sessionService.findSessionOrThrow(request.getSessionId())
                .flatMap(session -> {
                    if (role != UserRole.ADMIN
                            && (role != UserRole.PROVIDER || !userId.equals(session.getProviderId()))) {
                        return Mono.error(new BusinessException(ErrorCode.FORBIDDEN));
                    }
                    if (!SessionStatus.CONFIRMED.name().equals(session.getStatus())
                            && !SessionStatus.IN_PROGRESS.name().equals(session.getStatus())) {
                        return Mono.error(new BusinessException(ErrorCode.TRACKING_NOT_ALLOWED));
                    }
                    return locationTrackingRepository.existsBySessionIdAndIsActiveTrue(session.getId())
                            .flatMap(exists -> {
                                if (Boolean.TRUE.equals(exists)) {
                                    return Mono.error(new BusinessException(ErrorCode.TRACKING_ALREADY_ACTIVE));
                                }
                                return createTracking(session, request);
                            })
                            .flatMap(saved -> sessionService.startSession(session)
                                    .thenReturn(saved)
                                    // 세션 전이가 실패하면 방금 만든 추적 기록을 비활성화
                                    .onErrorResume(e -> deactivate(saved).then(Mono.error(e))));
                })
                .map(TrackingResponse::from)
                .doOnSuccess(res -> log.info("위치 추적 시작: sessionId={}, trackingId={}, distance={}",
                        res.getSessionId(), res.getId(), res.getDistanceToDestination()));
    }

    private Mono<LocationTracking> deactivate(LocationTracking tracking) {
        tracking.setIsActive(false);
        tracking.setUpdatedAt(LocalDateTime.now());
        return locationTrackingRepository.save(tracking)
                .doOnSuccess(t -> log.warn("세션 전이 실패로 위치 추적 비활성화: sessionId={}, trackingId={}",
                        t.getSessionId(), t.getId()));
    }

    private Mono<LocationTracking> createTracking(Session session, StartTrackingRequest request) {
        Double serviceLat = request.getServiceLatitude() != null ? request.getServiceLatitude() : session.getServiceLatitude();
        Double serviceLng = request.getServiceLongitude() != null ? request.getServiceLongitude() : session.getServiceLongitude();
        if (serviceLat == null || serviceLng == null) {
            return Mono.error(new BusinessException(ErrorCode.INVALID_INPUT, "서비스 위치 좌표가 필요합니다"));
        }
        LocalDateTime now = LocalDateTime.now();
        LocationTracking tracking = LocationTracking.builder()
                .sessionId(session.getId())
                .providerId(session.getProviderId())
                .seekerId(session.getSeekerId())
                .currentLatitude(request.getProviderLatitude())
                .currentLongitude(request.getProviderLongitude())
                .serviceLatitude(serviceLat)
                .serviceLongitude(serviceLng)
                .status(LocationStatus.ON_ROUTE.name())
                .distanceToDestination(GeoUtils.distanceMeters(
                        request.getProviderLatitude(), request.getProviderLongitude(), serviceLat, serviceLng))
                .isActive(true)
                .createdAt(now)
                .updatedAt(now)
                .build();
        return locationTrackingRepository.save(tracking)
                // 동시 시작 요청은 부분 유니크 인덱스에서 걸러진다
                .onErrorMap(DataIntegrityViolationException.class,
                        e -> new BusinessException(ErrorCode.TRACKING_ALREADY_ACTIVE));
    }

    public Mono<TrackingResponse> updateLocation(Long sessionId, LocationUpdateRequest request, Long userId, UserRole role) {
        return findActiveTracking(sessionId)
                .flatMap(tracking -> requireProviderOrAdmin(tracking, userId, role))
                .flatMap(tracking -> {
                    double distance = GeoUtils.distanceMeters(request.getLatitude(), request.getLongitude(),
                            tracking.getServiceLatitude(), tracking.getServiceLongitude());
                    LocalDateTime now = LocalDateTime.now();
                    tracking.setCurrentLatitude(request.getLatitude());
                    tracking.setCurrentLongitude(request.getLongitude());
                    tracking.setAccuracy(request.getAccuracy());
                    tracking.setSpeed(request.getSpeed());
                    tracking.setDistanceToDestination(distance);
                    tracking.setEstimatedArrivalTime(estimateArrival(distance, request.getSpeed(), now));
                    tracking.setUpdatedAt(now);

                    LocationStatus status = LocationStatus.valueOf(tracking.getStatus());
                    if (proximityPolicy.evaluate(status, distance).isPresent()) {
                        applyArrival(tracking, now);
                        log.info("서비스 장소 도착 자동 처리: sessionId={}, distance={}", sessionId, distance);
                    }
                    return locationTrackingRepository.save(tracking);
                })
                .flatMap(saved -> providerDirectoryService
                        .updateCurrentLocation(saved.getProviderId(), saved.getCurrentLatitude(), saved.getCurrentLongitude())
                        .thenReturn(saved))
                .map(TrackingResponse::from);
    }

    public Mono<TrackingResponse> markArrived(Long sessionId, Long userId, UserRole role) {
        return findActiveTracking(sessionId)
                .flatMap(tracking -> requireProviderOrAdmin(tracking, userId, role))
                .flatMap(tracking -> {
                    applyArrival(tracking, LocalDateTime.now());
                    return locationTrackingRepository.save(tracking);
                })
                .map(TrackingResponse::from)
                .doOnSuccess(res -> log.info("서비스 장소 도착: sessionId={}", sessionId));
    }

    // 상태는 바꾸지 않고 시작 시각만 기록
    public Mono<TrackingResponse> markServiceStarted(Long sessionId, Long userId, UserRole role) {
        return findActiveTracking(sessionId)
                .flatMap(tracking -> requireProviderOrAdmin(tracking, userId, role))
                .flatMap(tracking -> {
                    LocalDateTime now = LocalDateTime.now();
                    tracking.setServiceStartedAt(now);
                    tracking.setUpdatedAt(now);
                    return locationTrackingRepository.save(tracking);
                })
                .map(TrackingResponse::from)
                .doOnSuccess(res -> log.info("서비스 시작: sessionId={}", sessionId));
    }

    // 세션 COMPLETED 전이가 성공해야 추적을 종료한다
    public Mono<TrackingResponse> completeService(Long sessionId, Long userId, UserRole role) {
        return findActiveTracking(sessionId)
                .flatMap(tracking -> requireProviderOrAdmin(tracking, userId, role))
                .flatMap(tracking -> sessionService.completeSession(sessionId)
                        .then(Mono.defer(() -> {
                            LocalDateTime now = LocalDateTime.now();
                            tracking.setStatus(LocationStatus.SERVICE_COMPLETE.name());
                            tracking.setServiceCompletedAt(now);
                            tracking.setIsActive(false);
                            tracking.setUpdatedAt(now);
                            return locationTrackingRepository.save(tracking);
                        })))
                .map(TrackingResponse::from)
                .doOnSuccess(res -> log.info("서비스 완료: sessionId={}, userId={}", sessionId, userId));
    }

    // 비상 중단/취소용. 세션 상태는 건드리지 않는다
    public Mono<Void> stopTracking(Long sessionId, Long userId, UserRole role) {
        return findActiveTracking(sessionId)
                .flatMap(tracking -> {
                    if (role != UserRole.ADMIN && !userId.equals(tracking.getProviderId())
                            && !userId.equals(tracking.getSeekerId())) {
                        return Mono.error(new BusinessException(ErrorCode.FORBIDDEN));
                    }
                    tracking.setIsActive(false);
                    tracking.setUpdatedAt(LocalDateTime.now());
                    return locationTrackingRepository.save(tracking);
                })
                .doOnSuccess(v -> log.info("위치 추적 중단: sessionId={}, userId={}", sessionId, userId))
                .then();
    }

    public Mono<SeekerTrackingResponse> getSeekerTracking(Long sessionId, Long userId) {
        return sessionService.findSessionOrThrow(sessionId)
                .flatMap(session -> {
                    if (!userId.equals(session.getSeekerId())) {
                        return Mono.error(new BusinessException(ErrorCode.FORBIDDEN));
                    }
                    return locationTrackingRepository.findBySessionIdAndIsActiveTrue(sessionId)
                            .map(SeekerTrackingResponse::from)
                            .defaultIfEmpty(SeekerTrackingResponse.notStarted(sessionId));
                });
    }

    public Mono<TrackingResponse> getProviderTracking(Long sessionId, Long userId) {
        return locationTrackingRepository.findBySessionIdAndProviderIdAndIsActiveTrue(sessionId, userId)
                .switchIfEmpty(Mono.error(new BusinessException(ErrorCode.TRACKING_NOT_FOUND)))
                .map(TrackingResponse::from);
    }

    private Mono<LocationTracking> findActiveTracking(Long sessionId) {
        return locationTrackingRepository.findBySessionIdAndIsActiveTrue(sessionId)
                .switchIfEmpty(Mono.error(new BusinessException(ErrorCode.TRACKING_NOT_FOUND)));
    }

    private Mono<LocationTracking> requireProviderOrAdmin(LocationTracking tracking, Long userId, UserRole role) {
        if (role == UserRole.ADMIN || userId.equals(tracking.getProviderId())) {
            return Mono.just(tracking);
        }
        return Mono.error(new BusinessException(ErrorCode.FORBIDDEN));
    }

    // 이미 도착했거나 완료된 추적은 이전 단계로 돌아가지 않는다
    private static void applyArrival(LocationTracking tracking, LocalDateTime now) {
        if (!LocationStatus.ON_ROUTE.name().equals(tracking.getStatus())) {
            return;
        }
        tracking.setStatus(LocationStatus.AT_LOCATION.name());
        tracking.setArrivedAt(now);
        tracking.setUpdatedAt(now);
    }

    // 속도 정보가 있을 때만 도착 예정 시각 계산
    private static LocalDateTime estimateArrival(double distanceMeters, Double speed, LocalDateTime now) {
        if (speed == null || speed <= 0) {
            return null;
        }
        return now.plusSeconds(Math.round(distanceMeters / speed));
    }
}
