package com.has.domain.session.repository;

import com.has.domain.session.dto.StatusCount;
import com.has.domain.session.entity.Session;
import org.springframework.data.domain.Pageable;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.time.LocalDateTime;

public interface SessionRepository extends ReactiveCrudRepository<Session, Long> {

    // 일정 충돌 검사용: 제공자·날짜의 진행 중(활성) 세션
    Flux<Session> findByProviderIdAndSessionDateAndStatusIn(Long providerId, LocalDate sessionDate, String... statuses);

    Flux<Session> findBySeekerIdOrderByCreatedAtDesc(Long seekerId, Pageable pageable);

    Flux<Session> findBySeekerIdAndStatusOrderByCreatedAtDesc(Long seekerId, String status, Pageable pageable);

    Mono<Long> countBySeekerId(Long seekerId);

    Mono<Long> countBySeekerIdAndStatus(Long seekerId, String status);

    Flux<Session> findByProviderIdOrderBySessionDateDesc(Long providerId, Pageable pageable);

    Flux<Session> findByProviderIdAndStatusOrderBySessionDateDesc(Long providerId, String status, Pageable pageable);

    Mono<Long> countByProviderId(Long providerId);

    Mono<Long> countByProviderIdAndStatus(Long providerId, String status);

    // 배정 대기열: 오래된 요청부터
    Flux<Session> findByStatusOrderByCreatedAtAsc(String status, Pageable pageable);

    Mono<Long> countByStatus(String status);

    // 서비스 요청(배정 요청) 목록: 일반 카테고리 서비스 기반 세션
    @Query("SELECT s.* FROM sessions s JOIN services v ON s.service_id = v.id " +
           "WHERE s.seeker_id = :seekerId AND v.provider_id IS NULL ORDER BY s.created_at DESC")
    Flux<Session> findServiceRequestsBySeekerId(Long seekerId);

    @Query("SELECT * FROM sessions ORDER BY created_at DESC LIMIT :limit OFFSET :offset")
    Flux<Session> findPage(int limit, long offset);

    // 현재 상태가 expected일 때만 변경 (동시 상태 변경 시 한 요청만 성공)
    @Modifying
    @Query("UPDATE sessions SET status = :next, updated_at = :updatedAt WHERE id = :id AND status = :expected")
    Mono<Integer> updateStatusIfCurrent(Long id, String expected, String next, LocalDateTime updatedAt);

    // 전체 상태별 세션 수 (배정 통계용)
    @Query("SELECT status, COUNT(*) AS count FROM sessions GROUP BY status")
    Flux<StatusCount> countGroupByStatus();
}
