package com.ureca.gateway.publish.service;

import com.ureca.gateway.dlq.entity.DeadLetterErrorType;
import com.ureca.gateway.dlq.entity.FailedMessage;
import com.ureca.gateway.dlq.service.DeadLetterQueue;
import com.ureca.gateway.publish.dto.OutboundEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * 전달 실패 메시지를 DLQ 에 기록
 * DLQ 기록 실패는 로그만 남기고 삼킴 (발행 경로로 예외를 되돌리지 않음)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FailedDeliveryRecorder {

    private final DeadLetterQueue deadLetterQueue;
    private final OutboundEventSerializer serializer;

    public void record(OutboundEvent event, FailedMessage message, Throwable error,
                       DeadLetterErrorType errorType, int retryCount) {
        try {
            FailedMessage captured = message.capture(serializer.serialize(event), LocalDateTime.now());
            deadLetterQueue.add(captured, describe(error), errorType, retryCount);
        } catch (Exception e) {
            log.error("[DLQ] 등록 실패. 메시지 유실 가능. eventId: {}, idempotencyKey: {}, errorType: {}",
                    event.id(), message.getIdempotencyKey(), errorType, e);
        }
    }

    static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
    }
}
