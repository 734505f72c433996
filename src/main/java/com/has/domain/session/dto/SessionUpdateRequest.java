package com.has.domain.session.dto;

import com.has.domain.session.entity.PaymentStatus;
import com.has.domain.session.entity.SessionStatus;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Pattern;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;

// 전달된 항목만 변경. 날짜/시작 시각/시간이 바뀌면 종료 시각과 가격을 다시 계산
@Getter
@Setter
public class SessionUpdateRequest {
    private LocalDate sessionDate;

    @Pattern(regexp = "^([01]\\d|2[0-3]):([0-5]\\d)$", message = "시간은 HH:mm 형식이어야 합니다")
    private String startTime;

    @DecimalMin("0.5")
    @DecimalMax("12")
    private Double duration;

    private String notes;
    private SessionStatus status;
    private PaymentStatus paymentStatus;
    private String cancellationReason;

    public boolean changesSchedule() {
        return sessionDate != null || startTime != null || duration != null;
    }
}
