package com.has.domain.session.repository;

import com.has.domain.session.dto.RatingSummary;
import com.has.domain.session.dto.StatusAggregate;
import lombok.RequiredArgsConstructor;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 세션 목록 요약(상태별 건수, 완료 금액)은 GROUP BY 집계라 DatabaseClient로 직접 쿼리
 */
@Repository
@RequiredArgsConstructor
public class SessionQueryRepository {

    private final DatabaseClient databaseClient;

    public Flux<StatusAggregate> aggregateBySeeker(Long seekerId) {
        return aggregate("seeker_id", seekerId);
    }

    public Flux<StatusAggregate> aggregateByProvider(Long providerId) {
        return aggregate("provider_id", providerId);
    }

    // 수요자가 남긴 평점 기준 제공자 평균 평점
    public Mono<RatingSummary> ratingSummaryByProvider(Long providerId) {
        return databaseClient.sql("""
                SELECT COALESCE(AVG(seeker_rating), 0)::float8 AS avg_rating, COUNT(seeker_rating) AS cnt
                FROM sessions
                WHERE provider_id = :providerId AND seeker_rating IS NOT NULL
                """)
                .bind("providerId", providerId)
                .map((row, metadata) -> RatingSummary.builder()
                        .averageRating(row.get("avg_rating", Double.class))
                        .totalReviews(row.get("cnt", Long.class))
                        .build())
                .one();
    }

    private Flux<StatusAggregate> aggregate(String ownerColumn, Long ownerId) {
        return databaseClient.sql("""
                SELECT status, COUNT(*) AS cnt, COALESCE(SUM(total_amount), 0) AS amount
                FROM sessions
                WHERE %s = :ownerId
                GROUP BY status
                """.formatted(ownerColumn))
                .bind("ownerId", ownerId)
                .map((row, metadata) -> StatusAggregate.builder()
                        .status(row.get("status", String.class))
                        .count(row.get("cnt", Long.class))
                        .totalAmount(row.get("amount", Long.class))
                        .build())
                .all();
    }
}
