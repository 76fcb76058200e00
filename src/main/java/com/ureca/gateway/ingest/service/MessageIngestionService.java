package com.ureca.gateway.ingest.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.ureca.gateway.common.event.EventType;
import com.ureca.gateway.config.GatewayProperties;
import com.ureca.gateway.idempotency.service.IdempotencyGuard;
import com.ureca.gateway.idempotency.service.IdempotencyResult;
import com.ureca.gateway.ingest.dto.InboundEventRequest;
import com.ureca.gateway.ingest.dto.MessageReceivedData;
import com.ureca.gateway.ingest.exception.InvalidEventException;
import com.ureca.gateway.publish.dto.OutboundEvent;
import com.ureca.gateway.publish.service.PublishDispatcher;
import com.ureca.gateway.routing.service.RoutingRequest;
import com.ureca.gateway.routing.service.RoutingResolver;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 인바운드 메시지 처리
 * <p>
 * 검증 -> 멱등 확인 -> 라우팅 -> 아웃바운드 이벤트 생성 -> 백그라운드 발행 예약
 * 발행 결과는 기다리지 않음 (전달 실패는 DLQ 가 책임)
 */
@Slf4j
@Service
public class MessageIngestionService {

    // data JSON 최대 길이 (문자 수), payload 컬럼(MEDIUMTEXT)에 들어가는 크기
    static final int MAX_DATA_LENGTH = 1_000_000;

    private final IdempotencyGuard idempotencyGuard;
    private final RoutingResolver routingResolver;
    private final PublishDispatcher publishDispatcher;
    private final MeterRegistry meterRegistry;
    private final String eventSource;

    public MessageIngestionService(
            IdempotencyGuard idempotencyGuard,
            RoutingResolver routingResolver,
            PublishDispatcher publishDispatcher,
            MeterRegistry meterRegistry,
            GatewayProperties properties
    ) {
        this.idempotencyGuard = idempotencyGuard;
        this.routingResolver = routingResolver;
        this.publishDispatcher = publishDispatcher;
        this.meterRegistry = meterRegistry;
        this.eventSource = properties.broker().source();
    }

    /**
     * @param request 인바운드 CloudEvent
     * @return 처리 결과 (세 경우 모두 호출자에게는 성공)
     * @throws InvalidEventException data, idempotency_key, conversation_id 누락 또는 저장 한도 초과
     */
    public IngestOutcome ingest(InboundEventRequest request) {
        boolean messageReceived = EventType.find(request.type())
                .filter(type -> type == EventType.MESSAGE_RECEIVED)
                .isPresent();

        if (!messageReceived) {
            log.debug("[Ingest] 처리 대상이 아닌 이벤트 무시. type: {}, id: {}", request.type(), request.id());
            return count(IngestOutcome.IGNORED);
        }

        JsonNode data = request.data();
        if (data == null || !data.isObject()) {
            throw new InvalidEventException("Missing event data");
        }

        MessageReceivedData message = MessageReceivedData.from(data);

        if (message.idempotencyKey().isBlank()) {
            throw new InvalidEventException("Missing idempotency_key");
        }

        // 멱등 키를 소비하기 전에 거절
        message.findOversizedField().ifPresent(field -> {
            throw new InvalidEventException("Field too long: " + field);
        });

        if (data.toString().length() > MAX_DATA_LENGTH) {
            throw new InvalidEventException("Event data too large");
        }

        if (idempotencyGuard.checkAndMark(message.idempotencyKey()) == IdempotencyResult.DUPLICATE) {
            return count(IngestOutcome.DUPLICATE);
        }

        if (message.conversationId().isBlank()) {
            throw new InvalidEventException("Missing conversation_id");
        }

        String agentId = routingResolver.resolve(
                new RoutingRequest(message.conversationId(), message.senderId(), message.content()));

        OutboundEvent event = OutboundEvent.agentMessage(eventSource, agentId, data);

        publishDispatcher.dispatch(event, message.toFailedMessage());

        idempotencyGuard.recordProcessed(
                message.idempotencyKey(),
                message.messageId().isBlank() ? null : message.messageId());

        log.info("[Ingest] 메시지 라우팅. idempotencyKey: {}, conversationId: {}, agentId: {}, eventId: {}",
                message.idempotencyKey(), message.conversationId(), agentId, event.id());

        return count(IngestOutcome.ACCEPTED);
    }

    private IngestOutcome count(IngestOutcome outcome) {
        Counter.builder("gateway_ingest_total")
                .tag("outcome", outcome.name().toLowerCase())
                .register(meterRegistry).increment();
        return outcome;
    }
}
