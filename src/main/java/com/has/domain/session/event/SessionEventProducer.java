package com.has.domain.session.event;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.has.global.config.KafkaTopics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@Slf4j
@Service
@RequiredArgsConstructor
public class SessionEventProducer {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;

    // 세션 완료 이벤트 발행 → session-completed 토픽
    // key: sessionId (같은 세션의 이벤트 순서 보장)
    // 발행 실패는 로그만 남기고 완료 처리 결과에는 영향을 주지 않는다
    public Mono<Void> sendSessionCompletedEvent(SessionCompletedEvent event) {
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(event))
                .flatMap(message -> Mono.fromFuture(kafkaTemplate.send(
                        KafkaTopics.SESSION_COMPLETED,
                        String.valueOf(event.getSessionId()),
                        message)))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnSuccess(result -> log.info("[Kafka] session-completed 발행: sessionId={}, providerId={}, amount={}",
                        event.getSessionId(), event.getProviderId(), event.getAmount()))
                .doOnError(e -> log.error("[Kafka] session-completed 발행 실패: sessionId={}, error={}",
                        event.getSessionId(), e.getMessage(), e))
                .onErrorResume(e -> Mono.empty())
                .then();
    }
}
