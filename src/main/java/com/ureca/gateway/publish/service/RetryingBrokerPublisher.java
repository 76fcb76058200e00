package com.ureca.gateway.publish.service;

import com.ureca.gateway.config.GatewayProperties;
import com.ureca.gateway.dlq.entity.DeadLetterErrorType;
import com.ureca.gateway.dlq.entity.FailedMessage;
import com.ureca.gateway.publish.client.BrokerClient;
import com.ureca.gateway.publish.dto.OutboundEvent;
import com.ureca.gateway.publish.exception.DeliveryFailedException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

/**
 * 재시도 포함 브로커 발행
 * <p>
 * 최대 5회 시도, 시도 사이 지터 지수 백오프 (JitteredExponentialBackOffPolicy)
 * 모든 시도 실패 시 DLQ 등록 (BROKER_PUBLISH_FAILED, retryCount = 시도 횟수) 후 DeliveryFailedException
 * 시도는 순차적으로만 진행
 */
@Slf4j
@Component
public class RetryingBrokerPublisher {

    private final BrokerClient brokerClient;
    private final FailedDeliveryRecorder failedDeliveryRecorder;
    private final MeterRegistry meterRegistry;
    private final RetryTemplate retryTemplate;
    private final int maxAttempts;

    @Autowired
    public RetryingBrokerPublisher(
            BrokerClient brokerClient,
            FailedDeliveryRecorder failedDeliveryRecorder,
            MeterRegistry meterRegistry,
            GatewayProperties properties
    ) {
        this(brokerClient, failedDeliveryRecorder, meterRegistry, properties, new ThreadWaitSleeper());
    }

    RetryingBrokerPublisher(
            BrokerClient brokerClient,
            FailedDeliveryRecorder failedDeliveryRecorder,
            MeterRegistry meterRegistry,
            GatewayProperties properties,
            Sleeper sleeper
    ) {
        GatewayProperties.Publisher publisher = properties.publisher();

        this.brokerClient = brokerClient;
        this.failedDeliveryRecorder = failedDeliveryRecorder;
        this.meterRegistry = meterRegistry;
        this.maxAttempts = publisher.maxAttempts();

        this.retryTemplate = new RetryTemplate();
        this.retryTemplate.setRetryPolicy(new SimpleRetryPolicy(maxAttempts));
        this.retryTemplate.setBackOffPolicy(new JitteredExponentialBackOffPolicy(
                publisher.baseDelayMs(), publisher.maxDelayMs(), publisher.jitterMs(), sleeper));
    }

    /**
     * 재시도 포함 발행
     *
     * @param event   발행할 이벤트
     * @param message DLQ 기록용 실패 맥락
     * @throws DeliveryFailedException 모든 시도 실패 (DLQ 등록 이후)
     */
    public void publish(OutboundEvent event, FailedMessage message) {
        try {
            retryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.warn("[Broker Publish] 재시도. eventId: {}, attempt: {}/{}, lastError: {}",
                            event.id(), context.getRetryCount() + 1, maxAttempts,
                            context.getLastThrowable() == null ? null : context.getLastThrowable().getMessage());
                }
                attempt(event);
                return null;
            });

            Counter.builder("gateway_broker_publish_total")
                    .tag("result", "success")
                    .register(meterRegistry).increment();

            log.info("[Broker Publish] 발행 성공. eventId: {}, idempotencyKey: {}",
                    event.id(), message.getIdempotencyKey());

        } catch (RuntimeException e) {
            Counter.builder("gateway_broker_publish_total")
                    .tag("result", "fail")
                    .register(meterRegistry).increment();

            log.error("[Broker Publish] 재시도 소진. DLQ 이동. eventId: {}, idempotencyKey: {}, attempts: {}, error: {}",
                    event.id(), message.getIdempotencyKey(), maxAttempts, e.getMessage());

            failedDeliveryRecorder.record(event, message, e, DeadLetterErrorType.BROKER_PUBLISH_FAILED, maxAttempts);

            throw new DeliveryFailedException(event.id(), maxAttempts, e);
        }
    }

    /**
     * 단일 시도 발행 (DLQ 재전송용, 재시도/DLQ 등록 없음)
     */
    public void publishOnce(OutboundEvent event) {
        attempt(event);
    }

    private void attempt(OutboundEvent event) {
        Counter.builder("gateway_broker_publish_attempts")
                .register(meterRegistry).increment();
        brokerClient.send(event);
    }
}
