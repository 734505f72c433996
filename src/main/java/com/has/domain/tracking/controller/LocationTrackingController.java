package com.has.domain.tracking.controller;

import com.has.domain.tracking.dto.LocationUpdateRequest;
import com.has.domain.tracking.dto.SeekerTrackingResponse;
import com.has.domain.tracking.dto.StartTrackingRequest;
import com.has.domain.tracking.dto.TrackingResponse;
import com.has.domain.tracking.service.LocationTrackingService;
import com.has.global.security.SecurityUtils;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@Tag(name = "Location Tracking", description = "제공자 위치 추적 API")
@RestController
@RequestMapping("/api/v1/tracking")
@RequiredArgsConstructor
public class LocationTrackingController {

    private final LocationTrackingService locationTrackingService;

    @Operation(summary = "위치 추적 시작", description = "확정 세션은 진행 중 상태로 바뀝니다.")
    @PostMapping("/start")
    public Mono<ResponseEntity<TrackingResponse>> start(
            @Valid @RequestBody StartTrackingRequest request,
            @RequestHeader("X-User-Id") Long userId) {
        return SecurityUtils.currentRole()
                .flatMap(role -> locationTrackingService.startTracking(request, userId, role))
                .map(res -> ResponseEntity.status(HttpStatus.CREATED).body(res));
    }

    @Operation(summary = "위치 갱신", description = "서비스 장소 100m 이내면 자동으로 도착 처리됩니다.")
    @PutMapping("/{sessionId}/location")
    public Mono<ResponseEntity<TrackingResponse>> updateLocation(
            @PathVariable Long sessionId,
            @Valid @RequestBody LocationUpdateRequest request,
            @RequestHeader("X-User-Id") Long userId) {
        return SecurityUtils.currentRole()
                .flatMap(role -> locationTrackingService.updateLocation(sessionId, request, userId, role))
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "도착 처리")
    @PostMapping("/{sessionId}/arrived")
    public Mono<ResponseEntity<TrackingResponse>> arrived(
            @PathVariable Long sessionId,
            @RequestHeader("X-User-Id") Long userId) {
        return SecurityUtils.currentRole()
                .flatMap(role -> locationTrackingService.markArrived(sessionId, userId, role))
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "서비스 시작")
    @PostMapping("/{sessionId}/start-service")
    public Mono<ResponseEntity<TrackingResponse>> startService(
            @PathVariable Long sessionId,
            @RequestHeader("X-User-Id") Long userId) {
        return SecurityUtils.currentRole()
                .flatMap(role -> locationTrackingService.markServiceStarted(sessionId, userId, role))
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "서비스 완료", description = "세션이 완료 처리되고 제공자 정산이 진행됩니다.")
    @PostMapping("/{sessionId}/complete")
    public Mono<ResponseEntity<TrackingResponse>> complete(
            @PathVariable Long sessionId,
            @RequestHeader("X-User-Id") Long userId) {
        return SecurityUtils.currentRole()
                .flatMap(role -> locationTrackingService.completeService(sessionId, userId, role))
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "위치 추적 중단")
    @DeleteMapping("/{sessionId}")
    public Mono<ResponseEntity<Void>> stop(
            @PathVariable Long sessionId,
            @RequestHeader("X-User-Id") Long userId) {
        return SecurityUtils.currentRole()
                .flatMap(role -> locationTrackingService.stopTracking(sessionId, userId, role))
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }

    @Operation(summary = "수요자용 추적 정보")
    @GetMapping("/{sessionId}/seeker")
    public Mono<ResponseEntity<SeekerTrackingResponse>> seekerView(
            @PathVariable Long sessionId,
            @RequestHeader("X-User-Id") Long userId) {
        return locationTrackingService.getSeekerTracking(sessionId, userId)
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "제공자용 추적 정보")
    @GetMapping("/{sessionId}/provider")
    public Mono<ResponseEntity<TrackingResponse>> providerView(
            @PathVariable Long sessionId,
            @RequestHeader("X-User-Id") Long userId) {
        return locationTrackingService.getProviderTracking(sessionId, userId)
                .map(ResponseEntity::ok);
    }
}
