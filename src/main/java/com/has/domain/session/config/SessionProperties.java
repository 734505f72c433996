package com.has.domain.session.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "has.session")
public class SessionProperties {

    // true: 신규 세션은 제공자 없이 PENDING_ASSIGNMENT로 생성, 관리자가 배정
    private boolean requireAdminAssignment = true;
    // true: 관리자 배정 즉시 CONFIRMED, false: ASSIGNED 후 제공자 확인
    private boolean autoConfirmOnAssignment = true;
    // true: 배정된 제공자가 거절하면 PENDING_ASSIGNMENT로 되돌려 재배정
    private boolean returnToPoolOnProviderRejection = false;
    private int scheduleLockTtlSeconds = 10;
}
