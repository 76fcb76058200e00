package com.ureca.gateway.dlq.dto;

import com.ureca.gateway.dlq.entity.DeadLetterEntry;
import com.ureca.gateway.dlq.entity.DeadLetterErrorType;
import com.ureca.gateway.dlq.entity.DeadLetterStatus;
import com.ureca.gateway.dlq.entity.FailedMessage;

import java.time.LocalDateTime;

/**
 * DLQ 항목 조회 응답
 * 재전송용 payload 는 상세 조회에서만 포함
 */
public record DeadLetterEntryResponse(
        String id,
        String messageId,
        String idempotencyKey,
        String conversationId,
        long sequenceNumber,
        String senderId,
        String receiverId,
        String messageType,
        String content,
        String error,
        DeadLetterErrorType errorType,
        DeadLetterStatus status,
        int retryCount,
        int maxRetries,
        LocalDateTime nextRetryAt,
        LocalDateTime createdAt,
        LocalDateTime lastRetryAt,
        LocalDateTime resolvedAt,
        String resolvedReason,
        LocalDateTime expiresAt,
        String payload
) {
    public static DeadLetterEntryResponse summary(DeadLetterEntry entry) {
        return of(entry, false);
    }

    public static DeadLetterEntryResponse detail(DeadLetterEntry entry) {
        return of(entry, true);
    }

    private static DeadLetterEntryResponse of(DeadLetterEntry entry, boolean withPayload) {
        FailedMessage message = entry.getMessage();
        return new DeadLetterEntryResponse(
                entry.getId(),
                message.getMessageId(),
                message.getIdempotencyKey(),
                message.getConversationId(),
                message.getSequenceNumber(),
                message.getSenderId(),
                message.getReceiverId(),
                message.getMessageType(),
                message.getContent(),
                entry.getError(),
                entry.getErrorType(),
                entry.getStatus(),
                entry.getRetryCount(),
                entry.getMaxRetries(),
                entry.getNextRetryAt(),
                entry.getCreatedAt(),
                entry.getLastRetryAt(),
                entry.getResolvedAt(),
                entry.getResolvedReason(),
                entry.getExpiresAt(),
                withPayload ? message.getPayload() : null
        );
    }
}
