package com.has.domain.admin.controller;

import com.has.domain.admin.dto.AssignProviderRequest;
import com.has.domain.admin.dto.AvailableProvidersResponse;
import com.has.domain.admin.dto.PendingAssignmentsResponse;
import com.has.domain.admin.dto.RejectRequestRequest;
import com.has.domain.admin.service.AdminAssignmentService;
import com.has.domain.session.dto.SessionResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Map;

@Tag(name = "Admin Assignment", description = "관리자 제공자 배정 API")
@RestController
@RequestMapping("/api/v1/admin/assignments")
@RequiredArgsConstructor
public class AdminAssignmentController {

    private final AdminAssignmentService adminAssignmentService;

    @Operation(summary = "배정 대기 목록", description = "오래된 요청부터 반환합니다.")
    @GetMapping("/pending")
    public Mono<ResponseEntity<PendingAssignmentsResponse>> pending(
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int limit) {
        return adminAssignmentService.getPendingAssignments(page, limit)
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "배정 가능 제공자 검색", description = "평점 높은 순, 같으면 가까운 순으로 정렬합니다.")
    @GetMapping("/{sessionId}/providers")
    public Mono<ResponseEntity<AvailableProvidersResponse>> availableProviders(
            @PathVariable Long sessionId,
            @Parameter(description = "최소 평점") @RequestParam(required = false) Double minRating,
            @Parameter(description = "경력 수준") @RequestParam(required = false) String experienceLevel) {
        return adminAssignmentService.findAvailableProviders(sessionId, minRating, experienceLevel)
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "제공자 배정")
    @PostMapping("/{sessionId}/assign")
    public Mono<ResponseEntity<SessionResponse>> assign(
            @PathVariable Long sessionId,
            @Valid @RequestBody AssignProviderRequest request,
            @RequestHeader("X-User-Id") Long adminId) {
        return adminAssignmentService.assignProvider(sessionId, request.getProviderId(), adminId, request.getNotes())
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "서비스 요청 거절")
    @PostMapping("/{sessionId}/reject")
    public Mono<ResponseEntity<SessionResponse>> reject(
            @PathVariable Long sessionId,
            @Valid @RequestBody RejectRequestRequest request,
            @RequestHeader("X-User-Id") Long adminId) {
        return adminAssignmentService.rejectServiceRequest(sessionId, request.getReason(), request.getAdminNotes(), adminId)
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "상태별 세션 통계")
    @GetMapping("/stats")
    public Mono<ResponseEntity<Map<String, Long>>> stats() {
        return adminAssignmentService.getAssignmentStats()
                .map(ResponseEntity::ok);
    }
}
