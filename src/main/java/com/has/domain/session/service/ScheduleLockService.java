package com.has.domain.session.service;

import com.has.domain.session.config.SessionProperties;
import com.has.global.exception.BusinessException;
import com.has.global.exception.ErrorCode;
import com.has.global.util.RedisKeyGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.LocalDate;
import java.util.UUID;
import java.util.function.Supplier;

// 제공자·날짜 단위 일정 락. 가용성/충돌 검사와 세션 저장 사이에 다른 요청이 끼어들지 못하게 한다
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleLockService {

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final SessionProperties sessionProperties;

    public <T> Mono<T> withScheduleLock(Long providerId, LocalDate date, Supplier<Mono<T>> action) {
        // 제공자가 정해지지 않은 세션은 잠글 대상이 없다
        if (providerId == null) {
            return Mono.defer(action);
        }
        String lockKey = RedisKeyGenerator.scheduleLockKey(providerId, date);
        String token = UUID.randomUUID().toString();
        Duration ttl = Duration.ofSeconds(sessionProperties.getScheduleLockTtlSeconds());

        return Mono.usingWhen(
                acquire(lockKey, token, ttl),
                acquired -> action.get(),
                acquired -> release(lockKey, token));
    }

    private Mono<String> acquire(String lockKey, String token, Duration ttl) {
        return redisTemplate.opsForValue()
                .setIfAbsent(lockKey, token, ttl)
                .flatMap(success -> {
                    if (Boolean.TRUE.equals(success)) {
                        return Mono.just(token);
                    }
                    log.warn("일정 락 획득 실패: key={}", lockKey);
                    // 같은 제공자·날짜를 다른 요청이 처리 중: 일정 충돌로 보고 재시도는 호출자에게 맡긴다
                    return Mono.error(new BusinessException(ErrorCode.SCHEDULE_CONFLICT,
                            "같은 제공자의 같은 날짜 일정이 처리 중입니다"));
                });
    }

    // 내가 잡은 락만 해제 (TTL 만료 후 다른 요청이 잡은 락은 유지)
    private Mono<Void> release(String lockKey, String token) {
        return redisTemplate.opsForValue().get(lockKey)
                .filter(token::equals)
                .flatMap(owned -> redisTemplate.delete(lockKey))
                .then();
    }
}
