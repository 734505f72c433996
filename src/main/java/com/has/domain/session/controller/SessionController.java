package com.has.domain.session.controller;

import com.has.domain.session.dto.*;
import com.has.domain.session.entity.SessionStatus;
import com.has.domain.session.service.SessionService;
import com.has.global.security.SecurityUtils;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@Tag(name = "Session", description = "세션 생성/상태 변경/조회 API")
@RestController
@RequestMapping("/api/v1/sessions")
@RequiredArgsConstructor
public class SessionController {

    private final SessionService sessionService;

    @Operation(
            summary = "세션 생성",
            description = "서비스·날짜·시작 시각·시간으로 세션을 만듭니다. 종료 시각과 가격은 서버에서 계산합니다."
    )
    @PostMapping
    public Mono<ResponseEntity<SessionResponse>> createSession(
            @Valid @RequestBody SessionCreateRequest request,
            @RequestHeader("X-User-Id") Long userId) {
        return sessionService.createSession(userId, request)
                .map(SessionResponse::from)
                .map(res -> ResponseEntity.status(HttpStatus.CREATED).body(res));
    }

    @Operation(summary = "내 세션 목록 (수요자)")
    @GetMapping("/seeker")
    public Mono<ResponseEntity<SessionListResponse>> findBySeeker(
            @RequestHeader("X-User-Id") Long userId,
            @Parameter(description = "상태 필터") @RequestParam(required = false) SessionStatus status,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "10") int limit) {
        return sessionService.findBySeeker(userId, status, page, limit)
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "내 세션 목록 (제공자)", description = "요약에 완료 세션 금액 합계가 포함됩니다.")
    @GetMapping("/provider")
    public Mono<ResponseEntity<SessionListResponse>> findByProvider(
            @RequestHeader("X-User-Id") Long userId,
            @RequestParam(required = false) SessionStatus status,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "10") int limit) {
        return sessionService.findByProvider(userId, status, page, limit)
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "세션 단건 조회")
    @GetMapping("/{sessionId}")
    public Mono<ResponseEntity<SessionResponse>> findOne(
            @PathVariable Long sessionId,
            @RequestHeader("X-User-Id") Long userId) {
        return SecurityUtils.currentRole()
                .flatMap(role -> sessionService.findOne(sessionId, userId, role))
                .map(SessionResponse::from)
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "세션 수정", description = "일정 변경 시 가용성과 충돌을 다시 검사합니다.")
    @PatchMapping("/{sessionId}")
    public Mono<ResponseEntity<SessionResponse>> updateSession(
            @PathVariable Long sessionId,
            @Valid @RequestBody SessionUpdateRequest request,
            @RequestHeader("X-User-Id") Long userId) {
        return SecurityUtils.currentRole()
                .flatMap(role -> sessionService.updateSession(sessionId, request, userId, role))
                .map(SessionResponse::from)
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "세션 확정 (배정된 제공자/관리자)")
    @PostMapping("/{sessionId}/confirm")
    public Mono<ResponseEntity<SessionResponse>> confirmSession(
            @PathVariable Long sessionId,
            @RequestHeader("X-User-Id") Long userId) {
        return SecurityUtils.currentRole()
                .flatMap(role -> sessionService.confirmSession(sessionId, userId, role))
                .map(SessionResponse::from)
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "배정 거절 (배정된 제공자/관리자)")
    @PostMapping("/{sessionId}/reject")
    public Mono<ResponseEntity<SessionResponse>> rejectAssignment(
            @PathVariable Long sessionId,
            @RequestBody ReasonRequest request,
            @RequestHeader("X-User-Id") Long userId) {
        return SecurityUtils.currentRole()
                .flatMap(role -> sessionService.rejectAssignment(sessionId, userId, role, request.getReason()))
                .map(SessionResponse::from)
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "세션 취소", description = "완료된 세션은 취소할 수 없습니다. 결제된 세션은 환불 상태가 됩니다.")
    @PostMapping("/{sessionId}/cancel")
    public Mono<ResponseEntity<SessionResponse>> cancelSession(
            @PathVariable Long sessionId,
            @RequestBody ReasonRequest request,
            @RequestHeader("X-User-Id") Long userId) {
        return sessionService.cancelSession(sessionId, userId, request.getReason())
                .map(SessionResponse::from)
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "리뷰 등록", description = "완료된 세션의 수요자/제공자만 1~5점으로 평가할 수 있습니다.")
    @PostMapping("/{sessionId}/review")
    public Mono<ResponseEntity<SessionResponse>> addReview(
            @PathVariable Long sessionId,
            @Valid @RequestBody ReviewRequest request,
            @RequestHeader("X-User-Id") Long userId) {
        return sessionService.addReview(sessionId, userId, request)
                .map(SessionResponse::from)
                .map(ResponseEntity::ok);
    }
}
