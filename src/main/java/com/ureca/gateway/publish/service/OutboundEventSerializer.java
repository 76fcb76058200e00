package com.ureca.gateway.publish.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ureca.gateway.dlq.exception.DeadLetterSerializationException;
import com.ureca.gateway.publish.dto.OutboundEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * DLQ 보관용 OutboundEvent JSON 변환
 */
@Component
@RequiredArgsConstructor
public class OutboundEventSerializer {

    private final ObjectMapper objectMapper;

    public String serialize(OutboundEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new DeadLetterSerializationException("아웃바운드 이벤트 직렬화 실패. eventId: " + event.id(), e);
        }
    }

    /**
     * @throws DeadLetterSerializationException payload 가 비었거나 파싱 불가
     */
    public OutboundEvent deserialize(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new DeadLetterSerializationException("재전송할 payload 가 없습니다.", null);
        }
        try {
            return objectMapper.readValue(payload, OutboundEvent.class);
        } catch (JsonProcessingException e) {
            throw new DeadLetterSerializationException("아웃바운드 이벤트 역직렬화 실패", e);
        }
    }
}
