package com.ureca.gateway.idempotency.service;

import com.ureca.gateway.idempotency.repository.IdempotencyKeyRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * 선삽입 기반 멱등 가드 (강화 전략)
 * <p>
 * PK 유니크 제약으로 먼저 삽입한 요청만 FRESH
 * 확인과 기록이 하나의 INSERT 라 동시 중복에도 한 건만 통과
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "gateway.idempotency", name = "strategy", havingValue = "atomic")
public class AtomicInsertIdempotencyGuard implements IdempotencyGuard {

    private final IdempotencyKeyRepository idempotencyKeyRepository;

    @Override
    public IdempotencyResult checkAndMark(String key) {
        int inserted = idempotencyKeyRepository.insertIfAbsent(key, null, LocalDateTime.now());

        if (inserted == 0) {
            log.info("[Idempotency] 중복 이벤트 감지 (선삽입 실패). idempotencyKey: {}", key);
            return IdempotencyResult.DUPLICATE;
        }
        return IdempotencyResult.FRESH;
    }

    @Override
    public void recordProcessed(String key, String messageId) {
        // checkAndMark 에서 이미 기록
    }
}
