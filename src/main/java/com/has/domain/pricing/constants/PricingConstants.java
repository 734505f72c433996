package com.has.domain.pricing.constants;

// 카테고리 요금 기본값. 활성 설정이 없을 때 최초 1회 생성에 사용
public final class PricingConstants {

    private PricingConstants() {
        throw new UnsupportedOperationException("상수 클래스는 인스턴스화할 수 없습니다.");
    }

    public static final String CURRENCY = "FCFA";

    // 기본 세션: 4시간 3,000 FCFA
    public static final int DEFAULT_BASE_SESSION_PRICE = 3000;
    public static final double DEFAULT_BASE_SESSION_DURATION_HOURS = 4;

    // 초과 시간: 30분당 375 FCFA
    public static final int DEFAULT_OVERTIME_RATE = 375;
    public static final int DEFAULT_OVERTIME_INCREMENT_MINUTES = 30;

    public static final String DEFAULT_CONFIG_NOTES = "Default session configuration with category-based pricing";
}
