package com.ureca.gateway.dlq.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.Lob;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 전달 실패한 메시지의 맥락
 * <p>
 * 운영자가 원본 메시지를 식별할 수 있는 필드 + 재전송용 아웃바운드 이벤트 전체(payload)
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class FailedMessage {

    // 컬럼 길이, 인입 단계에서 같은 기준으로 검증
    public static final int ID_LENGTH = 64;
    public static final int IDEMPOTENCY_KEY_LENGTH = 255;
    public static final int MESSAGE_TYPE_LENGTH = 20;

    @Column(length = ID_LENGTH)
    private String messageId;

    @Column(nullable = false, length = IDEMPOTENCY_KEY_LENGTH)
    private String idempotencyKey;

    @Column(length = ID_LENGTH)
    private String conversationId;

    @Column(nullable = false)
    private long sequenceNumber;

    @Column(length = ID_LENGTH)
    private String senderId;

    @Column(length = ID_LENGTH)
    private String receiverId;

    @Column(nullable = false, length = MESSAGE_TYPE_LENGTH)
    private String messageType;

    @Lob
    @Column(columnDefinition = "MEDIUMTEXT")
    private String content;

    // 실패 시점에 생성
    private LocalDateTime messageTimestamp;

    // 아웃바운드 CloudEvent JSON
    @Lob
    @Column(columnDefinition = "MEDIUMTEXT")
    private String payload;

    @Builder(toBuilder = true)
    private FailedMessage(String messageId, String idempotencyKey, String conversationId,
                          long sequenceNumber, String senderId, String receiverId,
                          String messageType, String content, LocalDateTime messageTimestamp,
                          String payload
    ) {
        this.messageId = messageId;
        this.idempotencyKey = idempotencyKey;
        this.conversationId = conversationId;
        this.sequenceNumber = sequenceNumber;
        this.senderId = senderId;
        this.receiverId = receiverId;
        this.messageType = messageType == null ? "text" : messageType;
        this.content = content;
        this.messageTimestamp = messageTimestamp;
        this.payload = payload;
    }

    /**
     * 실패 시점 정보를 채운 사본 생성
     *
     * @param payload  아웃바운드 이벤트 JSON
     * @param failedAt 실패 시각
     */
    public FailedMessage capture(String payload, LocalDateTime failedAt) {
        return this.toBuilder()
                .payload(payload)
                .messageTimestamp(failedAt)
                .build();
    }
}
