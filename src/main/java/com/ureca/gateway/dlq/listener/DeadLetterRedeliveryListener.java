package com.ureca.gateway.dlq.listener;

import com.ureca.gateway.config.AsyncConfig;
import com.ureca.gateway.dlq.entity.DeadLetterEntry;
import com.ureca.gateway.dlq.event.DeadLetterRetryEvent;
import com.ureca.gateway.dlq.service.DeadLetterQueue;
import com.ureca.gateway.publish.dto.OutboundEvent;
import com.ureca.gateway.publish.service.OutboundEventSerializer;
import com.ureca.gateway.publish.service.RetryingBrokerPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * 스윕이 선점한 DLQ 항목 재전송
 * <p>
 * 저장된 payload 로 이벤트를 복원해서 새 이벤트 ID 로 한 번만 발행
 * 성공 -> RESOLVED, 실패 -> 재시도 횟수 증가 후 PENDING 또는 FAILED
 * payload 복원 실패도 재전송 실패로 기록
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DeadLetterRedeliveryListener {

    private final DeadLetterQueue deadLetterQueue;
    private final RetryingBrokerPublisher retryingBrokerPublisher;
    private final OutboundEventSerializer serializer;

    @Async(AsyncConfig.PUBLISH_EXECUTOR_NAME)
    @EventListener
    public void redeliver(DeadLetterRetryEvent event) {
        String entryId = event.entryId();

        try {
            DeadLetterEntry entry = deadLetterQueue.findById(entryId);

            OutboundEvent outboundEvent = serializer.deserialize(entry.getMessage().getPayload()).withNewId();

            log.info("[DLQ Redelivery] 재전송 시작. dlqId: {}, eventId: {}, retryCount: {}",
                    entryId, outboundEvent.id(), event.retryCount());

            retryingBrokerPublisher.publishOnce(outboundEvent);
            deadLetterQueue.recordRedeliverySuccess(entryId);

        } catch (Exception e) {
            log.warn("[DLQ Redelivery] 재전송 실패. dlqId: {}, error: {}", entryId, e.getMessage());
            deadLetterQueue.recordRedeliveryFailure(entryId, event.retryCount(), e.getMessage());
        }
    }
}
