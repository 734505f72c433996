package com.has.domain.wallet.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.has.domain.session.event.SessionCompletedEvent;
import com.has.global.config.KafkaTopics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

/**
 * session-completed 토픽 Consumer
 * 완료된 세션 금액을 제공자 지갑에 정산. 실패는 로그로 남기고 다음 메시지를 처리한다
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EarningSettlementConsumer {

    private final WalletService walletService;
    private final ObjectMapper objectMapper;

    @KafkaListener(
            topics = KafkaTopics.SESSION_COMPLETED,
            groupId = "${spring.kafka.consumer.group-id}"
    )
    public void handleSessionCompleted(
            @Payload String message,
            @Header(KafkaHeaders.RECEIVED_TOPIC) String topic,
            @Header(KafkaHeaders.OFFSET) long offset) {
        log.info("[Kafka] session-completed 수신: topic={}, offset={}, message={}",
                topic, offset, message);
        try {
            SessionCompletedEvent event = objectMapper.readValue(message, SessionCompletedEvent.class);
            if (event.getSessionId() == null || event.getProviderId() == null || event.getAmount() == null) {
                log.error("[Kafka] session-completed 필수 값 누락: offset={}, message={}", offset, message);
                return;
            }
            walletService.processEarning(event.getProviderId(), event.getSessionId(), event.getAmount())
                    .block();
        } catch (Exception e) {
            log.error("[Kafka] session-completed 정산 실패: offset={}, message={}, error={}",
                    offset, message, e.getMessage(), e);
        }
    }
}
