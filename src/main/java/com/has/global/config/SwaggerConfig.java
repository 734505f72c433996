package com.has.global.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI 문서 설정.
 * 역할은 토큰의 role 클레임에서만 읽으므로 인증 스키마는 HAS 액세스 토큰 하나다.
 * 문서는 수요자/제공자/관리자 화면 기준으로 그룹을 나눈다.
 */
@Configuration
public class SwaggerConfig {

    static final String ACCESS_TOKEN_SCHEME = "has-access-token";

    @Bean
    public OpenAPI hasOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("HAS Session API")
                        .version("v1")
                        .description("세션 예약, 관리자 배정, 위치 추적, 제공자 정산 API. "
                                + "역할(SEEKER/PROVIDER/ADMIN)은 액세스 토큰의 role 클레임으로 판별합니다."))
                .addSecurityItem(new SecurityRequirement().addList(ACCESS_TOKEN_SCHEME))
                .components(new Components()
                        .addSecuritySchemes(ACCESS_TOKEN_SCHEME, new SecurityScheme()
                                .type(SecurityScheme.Type.HTTP)
                                .scheme("bearer")
                                .bearerFormat("JWT")
                                .description("userId, role 클레임을 담은 HAS 액세스 토큰")));
    }

    @Bean
    public GroupedOpenApi seekerApi() {
        return GroupedOpenApi.builder()
                .group("1-seeker")
                .displayName("수요자: 세션/서비스 요청/추적 조회")
                .pathsToMatch("/api/v1/sessions/**", "/api/v1/service-requests/**",
                        "/api/v1/tracking/**", "/api/v1/pricing/**")
                .build();
    }

    @Bean
    public GroupedOpenApi providerApi() {
        return GroupedOpenApi.builder()
                .group("2-provider")
                .displayName("제공자: 가용 시간/위치 추적/지갑")
                .pathsToMatch("/api/v1/availability/**", "/api/v1/tracking/**", "/api/v1/wallet/**")
                .build();
    }

    @Bean
    public GroupedOpenApi adminApi() {
        return GroupedOpenApi.builder()
                .group("3-admin")
                .displayName("관리자: 배정/세션/요금 설정")
                .pathsToMatch("/api/v1/admin/**")
                .build();
    }
}
