package com.ureca.gateway.idempotency.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.time.LocalDateTime;

/**
 * 처리 완료된 인바운드 이벤트의 멱등 키
 * 레코드 존재 자체가 "이미 처리됨" 신호
 * 한 번 생성되면 변경/삭제하지 않음 (만료는 외부 책임)
 */
@Entity
@Table(name = "idempotency_keys")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class IdempotencyKey implements Persistable<String> {

    public static final int KEY_LENGTH = 255;

    @Id
    @Column(name = "idempotency_key", length = KEY_LENGTH)
    private String key;

    @Column(length = 64)
    private String messageId;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    // 할당 ID 라서 merge 대신 persist 되도록
    @Transient
    private boolean isNew = true;

    private IdempotencyKey(String key, String messageId, LocalDateTime createdAt) {
        this.key = key;
        this.messageId = messageId;
        this.createdAt = createdAt;
    }

    public static IdempotencyKey of(String key, String messageId) {
        return new IdempotencyKey(key, messageId, LocalDateTime.now());
    }

    @Override
    public String getId() {
        return key;
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
