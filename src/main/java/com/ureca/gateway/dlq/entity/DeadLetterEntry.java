package com.ureca.gateway.dlq.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(
        name = "dead_letter_queue",
        indexes = {
                // 스윕 대상 조회 전용
                @Index(name = "idx_dlq_status_next_retry",
                        columnList = "status, next_retry_at"),

                // 만료 정리 전용
                @Index(name = "idx_dlq_expires_at",
                        columnList = "expires_at"),

                // 상태별 최신순 조회
                @Index(name = "idx_dlq_created_at",
                        columnList = "created_at"),

                // 원본 메시지 추적용
                @Index(name = "idx_dlq_message_id",
                        columnList = "message_id")
        }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class DeadLetterEntry implements Persistable<String> {

    public static final int MAX_ERROR_LENGTH = 4000;

    private static final String UNKNOWN_ERROR = "unknown error";

    @Id
    @Column(name = "dlq_id", length = 36)
    private String id;

    @Embedded
    private FailedMessage message;

    @Lob
    @Column(columnDefinition = "TEXT", nullable = false)
    private String error;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private DeadLetterErrorType errorType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private DeadLetterStatus status;

    @Column(nullable = false)
    private Integer retryCount;

    @Column(nullable = false)
    private Integer maxRetries;

    // PENDING 일 때만 존재
    private LocalDateTime nextRetryAt;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    private LocalDateTime lastRetryAt;

    private LocalDateTime resolvedAt;

    @Column(length = 500)
    private String resolvedReason;

    @Column(nullable = false)
    private LocalDateTime expiresAt;

    @Transient
    private boolean isNew = true;

    @Builder
    private DeadLetterEntry(String id, FailedMessage message, String error,
                            DeadLetterErrorType errorType, DeadLetterStatus status,
                            Integer retryCount, Integer maxRetries, LocalDateTime nextRetryAt,
                            LocalDateTime createdAt, LocalDateTime expiresAt
    ) {
        this.id = id;
        this.message = message;
        this.error = error;
        this.errorType = errorType;
        this.status = status;
        this.retryCount = retryCount;
        this.maxRetries = maxRetries;
        this.nextRetryAt = nextRetryAt;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
    }

    /**
     * 실패 메시지를 DLQ 항목으로 생성
     * <p>
     * 재시도 여지가 있으면 PENDING + 다음 재시도 시각
     * 소진됐으면 FAILED (next_retry_at 없음)
     * 정책 최대치를 넘는 retryCount 는 최대치로 맞춤
     *
     * @param message    실패 맥락
     * @param error      마지막 에러 메시지
     * @param errorType  실패 분류
     * @param retryCount 이미 시도한 횟수
     * @param policy     재시도 정책
     * @param now        생성 시각
     */
    public static DeadLetterEntry create(
            FailedMessage message,
            String error,
            DeadLetterErrorType errorType,
            int retryCount,
            DeadLetterPolicy policy,
            LocalDateTime now
    ) {
        int clamped = Math.max(0, Math.min(retryCount, policy.maxRetries()));
        boolean exhausted = policy.isExhausted(clamped);

        return DeadLetterEntry.builder()
                .id(UUID.randomUUID().toString())
                .message(message)
                .error(errorMessage(error))
                .errorType(errorType)
                .status(exhausted ? DeadLetterStatus.FAILED : DeadLetterStatus.PENDING)
                .retryCount(clamped)
                .maxRetries(policy.maxRetries())
                .nextRetryAt(exhausted ? null : now.plus(Duration.ofMillis(policy.backoffMillis(clamped))))
                .createdAt(now)
                .expiresAt(now.plus(policy.ttl()))
                .build();
    }

    /**
     * 저장 가능한 에러 메시지 (null 이면 unknown error, 길면 잘라냄)
     */
    public static String errorMessage(String error) {
        if (error == null) {
            return UNKNOWN_ERROR;
        }
        return error.length() > MAX_ERROR_LENGTH ? error.substring(0, MAX_ERROR_LENGTH) : error;
    }

    public boolean isRetryable() {
        return status == DeadLetterStatus.PENDING && retryCount < maxRetries;
    }

    @Override
    public boolean isNew() {
        return isNew;
    }

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.isNew = false;
    }
}
