package com.has.domain.user.service;

import com.has.domain.catalog.entity.CameroonProvince;
import com.has.domain.catalog.entity.ServiceCategory;
import com.has.domain.user.dto.ProviderCandidate;
import com.has.domain.user.dto.ProviderSearchCondition;
import com.has.domain.user.entity.ProviderProfile;
import com.has.domain.user.entity.ProviderStatus;
import com.has.domain.user.entity.User;
import com.has.domain.user.entity.UserRole;
import com.has.domain.user.repository.ProviderProfileRepository;
import com.has.domain.user.repository.UserRepository;
import com.has.global.exception.BusinessException;
import com.has.global.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Arrays;

@Slf4j
@Service
@RequiredArgsConstructor
public class ProviderDirectoryService {

    private final UserRepository userRepository;
    private final ProviderProfileRepository providerProfileRepository;

    // 역할이 PROVIDER인 사용자만 제공자로 인정. 없으면 PROVIDER_NOT_FOUND
    public Mono<User> findProviderOrThrow(Long providerId) {
        return userRepository.findById(providerId)
                .filter(user -> UserRole.PROVIDER.name().equals(user.getRole()))
                .switchIfEmpty(Mono.error(new BusinessException(ErrorCode.PROVIDER_NOT_FOUND)));
    }

    // 배정 가능 여부 검증: 활성 상태, 카테고리 제공, 지역 담당
    public Mono<ProviderProfile> validateAssignable(Long providerId, ServiceCategory category, CameroonProvince area) {
        return findProviderOrThrow(providerId)
                .then(providerProfileRepository.findByUserId(providerId))
                .filter(profile -> ProviderStatus.ACTIVE.name().equals(profile.getStatus()))
                .switchIfEmpty(Mono.error(new BusinessException(ErrorCode.PROVIDER_NOT_ACTIVE)))
                .flatMap(profile -> {
                    if (!contains(profile.getServiceCategories(), category.name())) {
                        return Mono.error(new BusinessException(ErrorCode.PROVIDER_CATEGORY_MISMATCH));
                    }
                    if (area != null && !contains(profile.getServiceAreas(), area.name())) {
                        return Mono.error(new BusinessException(ErrorCode.PROVIDER_AREA_MISMATCH));
                    }
                    return Mono.just(profile);
                });
    }

    // 관리자 배정 화면용 제공자 검색 (카테고리/지역/최소 평점/경력)
    public Flux<ProviderCandidate> searchProviders(ProviderSearchCondition condition) {
        Flux<ProviderProfile> profiles = condition.getArea() != null
                ? providerProfileRepository.findActiveByCategoryAndArea(
                        condition.getCategory().name(), condition.getArea().name())
                : providerProfileRepository.findActiveByCategory(condition.getCategory().name());

        return profiles
                .filter(profile -> condition.getMinRating() == null
                        || (profile.getAverageRating() != null && profile.getAverageRating() >= condition.getMinRating()))
                .filter(profile -> condition.getExperienceLevel() == null
                        || condition.getExperienceLevel().equals(profile.getExperienceLevel()))
                .concatMap(profile -> userRepository.findById(profile.getUserId())
                        .filter(user -> UserRole.PROVIDER.name().equals(user.getRole())
                                && !Boolean.FALSE.equals(user.getIsActive()))
                        .map(user -> ProviderCandidate.builder()
                                .user(user)
                                .profile(profile)
                                .build()));
    }

    // 리뷰 등록 후 평균 평점 갱신
    public Mono<Void> updateRating(Long providerId, double averageRating, long totalReviews) {
        return providerProfileRepository.findByUserId(providerId)
                .flatMap(profile -> {
                    profile.setAverageRating(averageRating);
                    profile.setTotalReviews(Math.toIntExact(totalReviews));
                    profile.setUpdatedAt(LocalDateTime.now());
                    return providerProfileRepository.save(profile);
                })
                .doOnSuccess(saved -> log.info("제공자 평점 갱신: providerId={}, averageRating={}, totalReviews={}",
                        providerId, averageRating, totalReviews))
                .then();
    }

    // 위치 추적 중 보고된 제공자 현재 위치 (배정 후보 거리 정렬에 사용)
    public Mono<Void> updateCurrentLocation(Long providerId, double latitude, double longitude) {
        return providerProfileRepository.findByUserId(providerId)
                .flatMap(profile -> {
                    profile.setCurrentLatitude(latitude);
                    profile.setCurrentLongitude(longitude);
                    profile.setLastLocationUpdate(LocalDateTime.now());
                    return providerProfileRepository.save(profile);
                })
                .then();
    }

    private static boolean contains(String[] values, String value) {
        return values != null && Arrays.asList(values).contains(value);
    }
}
