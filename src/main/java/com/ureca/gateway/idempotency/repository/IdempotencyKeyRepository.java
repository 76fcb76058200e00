package com.ureca.gateway.idempotency.repository;

import com.ureca.gateway.idempotency.entity.IdempotencyKey;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

public interface IdempotencyKeyRepository extends JpaRepository<IdempotencyKey, String> {

    /**
     * 멱등 키 선점 (PK 유니크 제약 기반 원자적 삽입)
     * 이미 존재하면 무시되어 0 반환
     *
     * @param key       멱등 키
     * @param messageId 메시지 ID (없으면 null)
     * @param now       생성 시각
     * @return 삽입된 행 수 (0 또는 1)
     */
    @Transactional
    @Modifying
    @Query(value = "INSERT IGNORE INTO idempotency_keys (idempotency_key, message_id, created_at) " +
            "VALUES (:key, :messageId, :now)",
            nativeQuery = true)
    int insertIfAbsent(
            @Param("key") String key,
            @Param("messageId") String messageId,
            @Param("now") LocalDateTime now
    );
}
