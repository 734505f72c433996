package com.has.domain.availability.controller;

import com.has.domain.availability.dto.AvailabilityCreateRequest;
import com.has.domain.availability.dto.AvailabilityResponse;
import com.has.domain.availability.dto.AvailabilityUpdateRequest;
import com.has.domain.availability.service.AvailabilityService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;

@Tag(name = "Availability", description = "제공자 요일별 가용 시간 API")
@RestController
@RequestMapping("/api/v1/availability")
@RequiredArgsConstructor
public class AvailabilityController {

    private final AvailabilityService availabilityService;

    @Operation(summary = "가용 시간 등록", description = "요일당 1건만 등록할 수 있습니다.")
    @PostMapping
    public Mono<ResponseEntity<AvailabilityResponse>> create(
            @Valid @RequestBody AvailabilityCreateRequest request,
            @RequestHeader("X-User-Id") Long providerId) {
        return availabilityService.create(providerId, request)
                .map(res -> ResponseEntity.status(HttpStatus.CREATED).body(res));
    }

    @Operation(summary = "내 가용 시간 목록")
    @GetMapping("/me")
    public Flux<AvailabilityResponse> findMine(@RequestHeader("X-User-Id") Long providerId) {
        return availabilityService.findByProvider(providerId);
    }

    @Operation(summary = "제공자 가용 시간 목록")
    @GetMapping("/providers/{providerId}")
    public Flux<AvailabilityResponse> findByProvider(@PathVariable Long providerId) {
        return availabilityService.findByProvider(providerId);
    }

    @Operation(summary = "가용 여부 확인", description = "요청 구간 전체가 하나의 시간대에 포함되어야 가용입니다.")
    @GetMapping("/providers/{providerId}/check")
    public Mono<ResponseEntity<Boolean>> check(
            @PathVariable Long providerId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam String startTime,
            @RequestParam String endTime) {
        return availabilityService.isAvailable(providerId, date, startTime, endTime)
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "기본 가용 시간 설정", description = "등록되지 않은 평일에 09:00-17:00을 추가합니다.")
    @PostMapping("/default")
    public Flux<AvailabilityResponse> setDefault(@RequestHeader("X-User-Id") Long providerId) {
        return availabilityService.setDefaultAvailability(providerId);
    }

    @Operation(summary = "가용 시간 수정")
    @PatchMapping("/{id}")
    public Mono<ResponseEntity<AvailabilityResponse>> update(
            @PathVariable Long id,
            @Valid @RequestBody AvailabilityUpdateRequest request,
            @RequestHeader("X-User-Id") Long providerId) {
        return availabilityService.update(id, providerId, request)
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "가용 시간 삭제")
    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<Void>> remove(
            @PathVariable Long id,
            @RequestHeader("X-User-Id") Long providerId) {
        return availabilityService.remove(id, providerId)
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }
}
