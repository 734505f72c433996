package com.has.global.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // Common
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "C001", "잘못된 입력입니다"),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C002", "서버 오류가 발생했습니다"),
    INVALID_TIME_FORMAT(HttpStatus.BAD_REQUEST, "C003", "시간은 HH:mm 형식이어야 합니다"),

    // Auth
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "A001", "인증이 필요합니다"),
    INVALID_TOKEN(HttpStatus.UNAUTHORIZED, "A002", "유효하지 않은 토큰입니다"),
    FORBIDDEN(HttpStatus.FORBIDDEN, "A003", "해당 세션에 대한 권한이 없습니다"),

    // Catalog / Provider
    SERVICE_NOT_FOUND(HttpStatus.NOT_FOUND, "V001", "서비스를 찾을 수 없습니다"),
    SERVICE_UNAVAILABLE(HttpStatus.CONFLICT, "V002", "현재 예약할 수 없는 서비스입니다"),
    PROVIDER_NOT_FOUND(HttpStatus.NOT_FOUND, "V003", "제공자를 찾을 수 없습니다"),
    PROVIDER_NOT_ACTIVE(HttpStatus.BAD_REQUEST, "V004", "활성 상태의 제공자가 아닙니다"),
    PROVIDER_CATEGORY_MISMATCH(HttpStatus.BAD_REQUEST, "V005", "제공자가 해당 카테고리 서비스를 제공하지 않습니다"),
    PROVIDER_AREA_MISMATCH(HttpStatus.BAD_REQUEST, "V006", "제공자가 해당 지역을 담당하지 않습니다"),

    // Pricing
    CATEGORY_PRICING_NOT_FOUND(HttpStatus.NOT_FOUND, "P001", "카테고리 요금 설정을 찾을 수 없습니다"),
    INVALID_DURATION(HttpStatus.BAD_REQUEST, "P002", "세션 시간은 0.5시간 이상 12시간 이하여야 합니다"),

    // Availability
    AVAILABILITY_NOT_FOUND(HttpStatus.NOT_FOUND, "Y001", "가용 시간 정보를 찾을 수 없습니다"),
    AVAILABILITY_ALREADY_EXISTS(HttpStatus.BAD_REQUEST, "Y002", "해당 요일의 가용 시간이 이미 존재합니다"),
    INVALID_TIME_SLOT(HttpStatus.BAD_REQUEST, "Y003", "시간대의 시작 시각은 종료 시각보다 빨라야 합니다"),

    // Session
    SESSION_NOT_FOUND(HttpStatus.NOT_FOUND, "S001", "세션을 찾을 수 없습니다"),
    PROVIDER_UNAVAILABLE(HttpStatus.CONFLICT, "S002", "제공자가 요청한 시간에 가용하지 않습니다"),
    SCHEDULE_CONFLICT(HttpStatus.CONFLICT, "S003", "제공자가 요청한 시간에 이미 다른 세션이 있습니다"),
    INVALID_STATUS_TRANSITION(HttpStatus.BAD_REQUEST, "S004", "현재 상태에서 허용되지 않는 상태 전이입니다"),
    SESSION_NOT_PENDING_ASSIGNMENT(HttpStatus.BAD_REQUEST, "S005", "배정 대기 중인 세션이 아닙니다"),
    SESSION_COMPLETED(HttpStatus.BAD_REQUEST, "S006", "완료된 세션은 취소할 수 없습니다"),
    RESCHEDULE_NOT_ALLOWED(HttpStatus.BAD_REQUEST, "S007", "이미 시작되었거나 종료된 세션은 일정을 변경할 수 없습니다"),
    REVIEW_NOT_ALLOWED(HttpStatus.BAD_REQUEST, "S008", "완료된 세션만 리뷰할 수 있습니다"),
    INVALID_RATING(HttpStatus.BAD_REQUEST, "S009", "평점은 1점 이상 5점 이하여야 합니다"),
    PAYMENT_NOT_ALLOWED(HttpStatus.BAD_REQUEST, "S010", "취소되었거나 거절된 세션은 결제 처리할 수 없습니다"),
    PROVIDER_NOT_ASSIGNED(HttpStatus.BAD_REQUEST, "S011", "제공자가 배정되지 않은 세션입니다"),

    // Tracking
    TRACKING_NOT_FOUND(HttpStatus.NOT_FOUND, "T001", "활성화된 위치 추적 정보를 찾을 수 없습니다"),
    TRACKING_ALREADY_ACTIVE(HttpStatus.CONFLICT, "T002", "이 세션의 위치 추적이 이미 진행 중입니다"),
    TRACKING_NOT_ALLOWED(HttpStatus.BAD_REQUEST, "T003", "확정되었거나 진행 중인 세션만 위치 추적할 수 있습니다");

    private final HttpStatus status;
    private final String code;
    private final String message;
}
