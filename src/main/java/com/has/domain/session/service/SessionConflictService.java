package com.has.domain.session.service;

import com.has.domain.session.entity.Session;
import com.has.domain.session.entity.SessionStatus;
import com.has.domain.session.repository.SessionRepository;
import com.has.global.util.TimeOfDayUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.LocalDate;

@Slf4j
@Service
@RequiredArgsConstructor
public class SessionConflictService {

    private static final int MINUTES_PER_DAY = 24 * 60;

    private final SessionRepository sessionRepository;

    // 같은 제공자·날짜의 활성 세션과 시간이 겹치면 true. excludeSessionId는 일정 변경 시 자기 자신 제외용
    public Mono<Boolean> checkSessionConflict(Long providerId, LocalDate date, String startTime, String endTime,
                                              Long excludeSessionId) {
        return Mono.fromCallable(() -> toRange(startTime, endTime))
                .flatMap(range -> sessionRepository
                        .findByProviderIdAndSessionDateAndStatusIn(providerId, date, SessionStatus.activeStatusNames())
                        .filter(existing -> excludeSessionId == null || !excludeSessionId.equals(existing.getId()))
                        .filter(existing -> overlaps(toRange(existing.getStartTime(), existing.getEndTime()), range))
                        .next()
                        .map(existing -> {
                            log.debug("일정 충돌: providerId={}, date={}, {}-{}, existingSessionId={}",
                                    providerId, date, startTime, endTime, existing.getId());
                            return true;
                        })
                        .defaultIfEmpty(false));
    }

    // [a.start, a.end) 와 [b.start, b.end) 가 겹치는지. 경계가 맞닿는 것은 충돌 아님
    static boolean overlaps(int[] a, int[] b) {
        return a[0] < b[1] && a[1] > b[0];
    }

    // 종료 시각이 시작보다 이르면 자정을 넘긴 세션으로 본다
    private static int[] toRange(String startTime, String endTime) {
        int start = TimeOfDayUtils.toMinutes(startTime);
        int end = TimeOfDayUtils.toMinutes(endTime);
        if (end <= start) {
            end += MINUTES_PER_DAY;
        }
        return new int[]{start, end};
    }
}
