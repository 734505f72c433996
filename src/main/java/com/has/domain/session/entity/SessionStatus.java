package com.has.domain.session.entity;

import java.util.EnumSet;
import java.util.Set;

public enum SessionStatus {
    PENDING_ASSIGNMENT,  // 관리자 배정 대기 (제공자 없음)
    PENDING,             // 직접 예약, 제공자 확인 대기
    ASSIGNED,            // 관리자 배정 완료, 제공자 확인 대기
    CONFIRMED,           // 확정
    IN_PROGRESS,         // 진행 중
    COMPLETED,           // 완료 (종료 상태)
    CANCELLED,           // 취소 (종료 상태)
    REJECTED;            // 거절 (종료 상태)

    // 제공자 일정 충돌 판정 대상
    public static final Set<SessionStatus> ACTIVE_STATUSES =
            EnumSet.of(PENDING_ASSIGNMENT, PENDING, ASSIGNED, CONFIRMED, IN_PROGRESS);

    // 일정(날짜/시간) 변경 가능 상태
    public static final Set<SessionStatus> RESCHEDULABLE_STATUSES =
            EnumSet.of(PENDING_ASSIGNMENT, PENDING, ASSIGNED, CONFIRMED);

    // 일반 수정(PATCH)으로 바꿀 수 있는 상태. 배정/확정/거절은 전용 API로만
    public static final Set<SessionStatus> PATCHABLE_TARGETS =
            EnumSet.of(IN_PROGRESS, COMPLETED, CANCELLED);

    // 제공자 없이 도달할 수 있는 상태
    public static final Set<SessionStatus> PROVIDERLESS_STATUSES =
            EnumSet.of(PENDING_ASSIGNMENT, CANCELLED, REJECTED);

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == REJECTED;
    }

    public boolean canTransitionTo(SessionStatus next) {
        return switch (this) {
            case PENDING_ASSIGNMENT -> next == ASSIGNED || next == CONFIRMED || next == REJECTED || next == CANCELLED;
            case PENDING -> next == CONFIRMED || next == REJECTED || next == CANCELLED;
            case ASSIGNED -> next == CONFIRMED || next == REJECTED || next == PENDING_ASSIGNMENT || next == CANCELLED;
            case CONFIRMED -> next == IN_PROGRESS || next == CANCELLED;
            case IN_PROGRESS -> next == COMPLETED;
            case COMPLETED, CANCELLED, REJECTED -> false;
        };
    }

    public static String[] activeStatusNames() {
        return ACTIVE_STATUSES.stream().map(Enum::name).toArray(String[]::new);
    }
}
