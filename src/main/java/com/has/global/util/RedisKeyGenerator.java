package com.has.global.util;

import java.time.LocalDate;

// Redis 키 생성을 위한 유틸리티 클래스
public class RedisKeyGenerator {

    private RedisKeyGenerator() {
        throw new UnsupportedOperationException("유틸리티 클래스는 인스턴스화할 수 없습니다.");
    }

    // 제공자 일정 분산 락 키 (String+TTL) - lock:schedule:{providerId}:{yyyy-MM-dd}
    // 가용성/충돌 검사 후 세션 저장까지 같은 제공자·날짜의 동시 요청을 직렬화
    public static String scheduleLockKey(Long providerId, LocalDate date) {
        return String.format("lock:schedule:%d:%s", providerId, date);
    }
}
