package com.has.domain.availability.service;

import com.has.domain.availability.dto.AvailabilityCreateRequest;
import com.has.domain.availability.dto.AvailabilityResponse;
import com.has.domain.availability.dto.AvailabilityUpdateRequest;
import com.has.domain.availability.dto.TimeSlotRequest;
import com.has.domain.availability.entity.Availability;
import com.has.domain.availability.entity.AvailabilityTimeSlot;
import com.has.domain.availability.repository.AvailabilityRepository;
import com.has.domain.availability.repository.AvailabilityTimeSlotRepository;
import com.has.global.exception.BusinessException;
import com.has.global.exception.ErrorCode;
import com.has.global.util.TimeOfDayUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class AvailabilityService {

    private static final List<DayOfWeek> DEFAULT_WORK_DAYS = List.of(
            DayOfWeek.MONDAY, DayOfWeek.TUESDAY, DayOfWeek.WEDNESDAY, DayOfWeek.THURSDAY, DayOfWeek.FRIDAY);
    private static final String DEFAULT_START = "09:00";
    private static final String DEFAULT_END = "17:00";

    private final AvailabilityRepository availabilityRepository;
    private final AvailabilityTimeSlotRepository timeSlotRepository;

    public Mono<AvailabilityResponse> create(Long providerId, AvailabilityCreateRequest request) {
        return Mono.fromRunnable(() -> validateTimeSlots(request.getTimeSlots()))
                .then(Mono.defer(() -> availabilityRepository.existsByProviderIdAndDayOfWeek(
                        providerId, request.getDayOfWeek().name())))
                .flatMap(exists -> {
                    if (Boolean.TRUE.equals(exists)) {
                        return Mono.error(new BusinessException(ErrorCode.AVAILABILITY_ALREADY_EXISTS));
                    }
                    Availability availability = Availability.builder()
                            .providerId(providerId)
                            .dayOfWeek(request.getDayOfWeek().name())
                            .isActive(true)
                            .notes(request.getNotes())
                            .createdAt(LocalDateTime.now())
                            .updatedAt(LocalDateTime.now())
                            .build();
                    return availabilityRepository.save(availability);
                })
                .flatMap(saved -> saveTimeSlots(saved.getId(), request.getTimeSlots())
                        .map(slots -> AvailabilityResponse.of(saved, slots)))
                .doOnSuccess(res -> log.info("가용 시간 등록: providerId={}, dayOfWeek={}, slots={}",
                        providerId, res.getDayOfWeek(), res.getTimeSlots().size()));
    }

    public Flux<AvailabilityResponse> findByProvider(Long providerId) {
        return availabilityRepository.findByProviderIdOrderByDayOfWeek(providerId)
                .concatMap(this::toResponse);
    }

    public Mono<AvailabilityResponse> update(Long id, Long providerId, AvailabilityUpdateRequest request) {
        return availabilityRepository.findByIdAndProviderId(id, providerId)
                .switchIfEmpty(Mono.error(new BusinessException(ErrorCode.AVAILABILITY_NOT_FOUND)))
                .flatMap(availability -> {
                    if (request.getTimeSlots() != null) {
                        validateTimeSlots(request.getTimeSlots());
                    }
                    if (request.getIsActive() != null) {
                        availability.setIsActive(request.getIsActive());
                    }
                    if (request.getNotes() != null) {
                        availability.setNotes(request.getNotes());
                    }
                    availability.setUpdatedAt(LocalDateTime.now());
                    return availabilityRepository.save(availability);
                })
                .flatMap(saved -> {
                    if (request.getTimeSlots() == null) {
                        return toResponse(saved);
                    }
                    // 시간대는 전체 교체
                    return timeSlotRepository.deleteByAvailabilityId(saved.getId())
                            .then(saveTimeSlots(saved.getId(), request.getTimeSlots()))
                            .map(slots -> AvailabilityResponse.of(saved, slots));
                })
                .doOnSuccess(res -> log.info("가용 시간 수정: availabilityId={}, providerId={}", id, providerId));
    }

    public Mono<Void> remove(Long id, Long providerId) {
        return availabilityRepository.findByIdAndProviderId(id, providerId)
                .switchIfEmpty(Mono.error(new BusinessException(ErrorCode.AVAILABILITY_NOT_FOUND)))
                .flatMap(availability -> timeSlotRepository.deleteByAvailabilityId(availability.getId())
                        .then(availabilityRepository.delete(availability)))
                .doOnSuccess(v -> log.info("가용 시간 삭제: availabilityId={}, providerId={}", id, providerId));
    }

    // 평일 09:00-17:00 기본 가용 시간. 이미 등록된 요일은 건드리지 않는다
    public Flux<AvailabilityResponse> setDefaultAvailability(Long providerId) {
        return Flux.fromIterable(DEFAULT_WORK_DAYS)
                .concatMap(day -> availabilityRepository.existsByProviderIdAndDayOfWeek(providerId, day.name())
                        .filter(exists -> !exists)
                        .flatMap(missing -> {
                            AvailabilityCreateRequest request = new AvailabilityCreateRequest();
                            request.setDayOfWeek(day);
                            request.setTimeSlots(List.of(new TimeSlotRequest(DEFAULT_START, DEFAULT_END, true)));
                            request.setNotes("Default working hours");
                            return create(providerId, request);
                        }));
    }

    // 요청 구간 전체가 하나의 가용 시간대 안에 들어가야 true. 인접한 두 시간대에 걸치면 false
    public Mono<Boolean> isAvailable(Long providerId, LocalDate date, String startTime, String endTime) {
        String dayOfWeek = date.getDayOfWeek().name();
        return Mono.fromCallable(() -> new int[]{TimeOfDayUtils.toMinutes(startTime), TimeOfDayUtils.toMinutes(endTime)})
                .flatMap(range -> availabilityRepository.findByProviderIdAndDayOfWeekAndIsActiveTrue(providerId, dayOfWeek)
                        .flatMap(availability -> timeSlotRepository.findByAvailabilityIdOrderBySlotOrder(availability.getId())
                                .collectList())
                        .map(slots -> covers(slots, range[0], range[1])))
                .defaultIfEmpty(false)
                .doOnSuccess(available -> {
                    if (!Boolean.TRUE.equals(available)) {
                        log.debug("제공자 비가용: providerId={}, date={}, {}-{}", providerId, date, startTime, endTime);
                    }
                });
    }

    static boolean covers(List<AvailabilityTimeSlot> slots, int start, int end) {
        // 자정을 넘기는 요청은 하루 단위 시간대에 담길 수 없다
        if (end <= start) {
            return false;
        }
        return slots.stream()
                .filter(slot -> Boolean.TRUE.equals(slot.getIsAvailable()))
                .anyMatch(slot -> start >= TimeOfDayUtils.toMinutes(slot.getStartTime())
                        && end <= TimeOfDayUtils.toMinutes(slot.getEndTime()));
    }

    private Mono<AvailabilityResponse> toResponse(Availability availability) {
        return timeSlotRepository.findByAvailabilityIdOrderBySlotOrder(availability.getId())
                .collectList()
                .map(slots -> AvailabilityResponse.of(availability, slots));
    }

    private Mono<List<AvailabilityTimeSlot>> saveTimeSlots(Long availabilityId, List<TimeSlotRequest> requests) {
        List<AvailabilityTimeSlot> slots = new ArrayList<>();
        for (int i = 0; i < requests.size(); i++) {
            TimeSlotRequest request = requests.get(i);
            slots.add(AvailabilityTimeSlot.builder()
                    .availabilityId(availabilityId)
                    .slotOrder(i)
                    .startTime(request.getStartTime())
                    .endTime(request.getEndTime())
                    .isAvailable(request.getIsAvailable() == null || request.getIsAvailable())
                    .build());
        }
        return timeSlotRepository.saveAll(slots).collectList();
    }

    private static void validateTimeSlots(List<TimeSlotRequest> slots) {
        if (slots == null || slots.isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "시간대가 최소 1개 필요합니다");
        }
        List<int[]> ranges = new ArrayList<>();
        for (TimeSlotRequest slot : slots) {
            int start = TimeOfDayUtils.toMinutes(slot.getStartTime());
            int end = TimeOfDayUtils.toMinutes(slot.getEndTime());
            if (start >= end) {
                throw new BusinessException(ErrorCode.INVALID_TIME_SLOT,
                        "시작 시각은 종료 시각보다 빨라야 합니다: " + slot.getStartTime() + "-" + slot.getEndTime());
            }
            ranges.add(new int[]{start, end});
        }
        // 시작 시각 순으로 정렬 후 인접 구간끼리 비교. 맞닿는 것(10:00-12:00, 12:00-14:00)은 허용
        ranges.sort(Comparator.comparingInt(range -> range[0]));
        for (int i = 1; i < ranges.size(); i++) {
            if (ranges.get(i)[0] < ranges.get(i - 1)[1]) {
                throw new BusinessException(ErrorCode.INVALID_TIME_SLOT,
                        "시간대가 서로 겹칩니다: " + TimeOfDayUtils.format(ranges.get(i)[0]));
            }
        }
    }
}
