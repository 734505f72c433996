package com.has.domain.admin.controller;

import com.has.domain.session.dto.SessionResponse;
import com.has.domain.session.service.SessionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

@Tag(name = "Admin Session", description = "관리자 세션 조회 API")
@RestController
@RequestMapping("/api/v1/admin/sessions")
@RequiredArgsConstructor
public class AdminSessionController {

    private final SessionService sessionService;

    @Operation(summary = "전체 세션 목록", description = "최근 생성 순")
    @GetMapping
    public Flux<SessionResponse> findAll(
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int limit) {
        return sessionService.findAll(page, limit)
                .map(SessionResponse::from);
    }
}
