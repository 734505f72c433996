package com.has.domain.session.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

// session-completed 토픽 메시지. 제공자 지갑 정산 트리거
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionCompletedEvent {
    private Long sessionId;
    private Long providerId;
    private Integer amount;
}
