package com.has.global.security;

import com.has.domain.user.entity.UserRole;
import com.has.global.exception.BusinessException;
import com.has.global.exception.ErrorCode;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.security.core.context.SecurityContext;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Arrays;

/**
 * 리액티브 SecurityContext에서 호출자 역할을 꺼낸다.
 * 역할은 JwtAuthenticationFilter가 토큰에서 검증해 넣은 ROLE_{role} 권한만 신뢰한다.
 */
public final class SecurityUtils {

    private static final String ROLE_PREFIX = "ROLE_";

    private SecurityUtils() {
    }

    public static Mono<UserRole> currentRole() {
        return ReactiveSecurityContextHolder.getContext()
                .map(SecurityContext::getAuthentication)
                .filter(Authentication::isAuthenticated)
                .flatMapMany(auth -> Flux.fromIterable(auth.getAuthorities()))
                .map(GrantedAuthority::getAuthority)
                .filter(authority -> authority.startsWith(ROLE_PREFIX))
                .map(authority -> authority.substring(ROLE_PREFIX.length()))
                .filter(SecurityUtils::isKnownRole)
                .next()
                .map(UserRole::valueOf)
                .switchIfEmpty(Mono.error(new BusinessException(ErrorCode.UNAUTHORIZED)));
    }

    private static boolean isKnownRole(String name) {
        return Arrays.stream(UserRole.values()).anyMatch(role -> role.name().equals(name));
    }
}
