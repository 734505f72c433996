package com.has.domain.user.repository;

import com.has.domain.user.entity.ProviderProfile;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface ProviderProfileRepository extends ReactiveCrudRepository<ProviderProfile, Long> {

    Mono<ProviderProfile> findByUserId(Long userId);

    // 카테고리·지역을 모두 담당하는 활성 제공자 프로필
    @Query("SELECT * FROM provider_profiles " +
           "WHERE status = 'ACTIVE' " +
           "AND :category = ANY(service_categories) " +
           "AND :area = ANY(service_areas)")
    Flux<ProviderProfile> findActiveByCategoryAndArea(String category, String area);

    // 지역 정보가 없는 세션(직접 예약)용
    @Query("SELECT * FROM provider_profiles " +
           "WHERE status = 'ACTIVE' " +
           "AND :category = ANY(service_categories)")
    Flux<ProviderProfile> findActiveByCategory(String category);
}
