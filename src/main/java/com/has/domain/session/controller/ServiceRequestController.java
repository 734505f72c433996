package com.has.domain.session.controller;

import com.has.domain.session.dto.ServiceRequestCreateRequest;
import com.has.domain.session.dto.ServiceRequestResponse;
import com.has.domain.session.service.ServiceRequestService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Tag(name = "Service Request", description = "제공자 미지정 서비스 요청 API")
@RestController
@RequestMapping("/api/v1/service-requests")
@RequiredArgsConstructor
public class ServiceRequestController {

    private final ServiceRequestService serviceRequestService;

    @Operation(summary = "서비스 요청 생성", description = "관리자가 제공자를 배정할 때까지 PENDING_ASSIGNMENT 상태로 남습니다.")
    @PostMapping
    public Mono<ResponseEntity<ServiceRequestResponse>> create(
            @Valid @RequestBody ServiceRequestCreateRequest request,
            @RequestHeader("X-User-Id") Long userId) {
        return serviceRequestService.createServiceRequest(userId, request)
                .map(res -> ResponseEntity.status(HttpStatus.CREATED).body(res));
    }

    @Operation(summary = "내 서비스 요청 목록")
    @GetMapping("/my-requests")
    public Flux<ServiceRequestResponse> myRequests(@RequestHeader("X-User-Id") Long userId) {
        return serviceRequestService.getUserServiceRequests(userId);
    }

    @Operation(summary = "서비스 요청 상태 조회")
    @GetMapping("/{requestId}/status")
    public Mono<ResponseEntity<ServiceRequestResponse>> status(
            @PathVariable Long requestId,
            @RequestHeader("X-User-Id") Long userId) {
        return serviceRequestService.getServiceRequestStatus(requestId, userId)
                .map(ResponseEntity::ok);
    }
}
