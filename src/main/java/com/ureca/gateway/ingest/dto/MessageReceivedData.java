package com.ureca.gateway.ingest.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.ureca.gateway.dlq.entity.FailedMessage;
import com.ureca.gateway.idempotency.entity.IdempotencyKey;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * messaging.message.received 이벤트의 data
 * 없는 필드는 빈 문자열, sequence_number 는 0 으로 읽음
 */
public record MessageReceivedData(
        String messageId,
        String idempotencyKey,
        String conversationId,
        long sequenceNumber,
        String senderId,
        String receiverId,
        String messageType,
        String content
) {
    public static MessageReceivedData from(JsonNode data) {
        return new MessageReceivedData(
                data.path("message_id").asText(""),
                data.path("idempotency_key").asText(""),
                data.path("conversation_id").asText(""),
                data.path("sequence_number").asLong(0L),
                data.path("sender_id").asText(""),
                data.path("receiver_id").asText(""),
                data.path("message_type").asText("text"),
                data.path("content").asText("")
        );
    }

    /**
     * 저장 컬럼 길이를 넘는 첫 번째 필드
     * 넘는 값이 있으면 DLQ 기록과 멱등 키 기록이 실패하므로 인입 단계에서 거절
     */
    public Optional<String> findOversizedField() {
        if (idempotencyKey.length() > IdempotencyKey.KEY_LENGTH) {
            return Optional.of("idempotency_key");
        }

        Map<String, String> identifiers = new LinkedHashMap<>();
        identifiers.put("message_id", messageId);
        identifiers.put("conversation_id", conversationId);
        identifiers.put("sender_id", senderId);
        identifiers.put("receiver_id", receiverId);

        Optional<String> oversizedId = identifiers.entrySet().stream()
                .filter(entry -> entry.getValue().length() > FailedMessage.ID_LENGTH)
                .map(Map.Entry::getKey)
                .findFirst();

        if (oversizedId.isPresent()) {
            return oversizedId;
        }

        return messageType.length() > FailedMessage.MESSAGE_TYPE_LENGTH
                ? Optional.of("message_type")
                : Optional.empty();
    }

    // payload 와 실패 시각은 실패 시점에 채움
    public FailedMessage toFailedMessage() {
        return FailedMessage.builder()
                .messageId(messageId.isBlank() ? null : messageId)
                .idempotencyKey(idempotencyKey)
                .conversationId(conversationId)
                .sequenceNumber(sequenceNumber)
                .senderId(senderId)
                .receiverId(receiverId)
                .messageType(messageType.isBlank() ? "text" : messageType)
                .content(content)
                .build();
    }
}
