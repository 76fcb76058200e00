package com.ureca.gateway.publish.service;

import com.ureca.gateway.config.AsyncConfig;
import com.ureca.gateway.dlq.entity.DeadLetterErrorType;
import com.ureca.gateway.dlq.entity.FailedMessage;
import com.ureca.gateway.publish.dto.OutboundEvent;
import com.ureca.gateway.publish.exception.DeliveryFailedException;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * 백그라운드 발행 디스패처
 * <p>
 * 인입 스레드는 발행 결과를 기다리지 않고 바로 반환
 * 발행 풀(큐 제한)이 가득 차서 거절되면 버리지 않고 DLQ 에 SERVICE_UNAVAILABLE 로 등록
 * -> 재시도 횟수 0 의 PENDING 이라 복구 스윕이 이어서 처리
 */
@Slf4j
@Component
public class PublishDispatcher {

    private final ThreadPoolTaskExecutor publishExecutor;
    private final RetryingBrokerPublisher retryingBrokerPublisher;
    private final FailedDeliveryRecorder failedDeliveryRecorder;

    public PublishDispatcher(
            @Qualifier(AsyncConfig.PUBLISH_EXECUTOR_NAME) ThreadPoolTaskExecutor publishExecutor,
            RetryingBrokerPublisher retryingBrokerPublisher,
            FailedDeliveryRecorder failedDeliveryRecorder,
            MeterRegistry meterRegistry
    ) {
        this.publishExecutor = publishExecutor;
        this.retryingBrokerPublisher = retryingBrokerPublisher;
        this.failedDeliveryRecorder = failedDeliveryRecorder;

        Gauge.builder("gateway_publish_backlog", publishExecutor,
                        executor -> executor.getThreadPoolExecutor().getQueue().size())
                .description("발행 풀 대기 작업 수")
                .register(meterRegistry);
        Gauge.builder("gateway_publish_active", publishExecutor, ThreadPoolTaskExecutor::getActiveCount)
                .description("발행 중인 스레드 수")
                .register(meterRegistry);
    }

    public void dispatch(OutboundEvent event, FailedMessage message) {
        try {
            publishExecutor.execute(() -> publishInBackground(event, message));
        } catch (TaskRejectedException e) {
            log.warn("[Broker Publish] 발행 풀 포화. DLQ 로 이관. eventId: {}, idempotencyKey: {}",
                    event.id(), message.getIdempotencyKey());

            failedDeliveryRecorder.record(event, message, e, DeadLetterErrorType.SERVICE_UNAVAILABLE, 0);
        }
    }

    private void publishInBackground(OutboundEvent event, FailedMessage message) {
        try {
            retryingBrokerPublisher.publish(event, message);
        } catch (DeliveryFailedException e) {
            // DLQ 등록까지 끝난 상태
            log.warn("[Broker Publish] 백그라운드 발행 최종 실패. eventId: {}", event.id());
        } catch (Exception e) {
            log.error("[Broker Publish] 백그라운드 발행 중 예상치 못한 오류. eventId: {}", event.id(), e);
        }
    }
}
