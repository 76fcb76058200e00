package com.ureca.gateway.idempotency.service;

import com.ureca.gateway.idempotency.entity.IdempotencyKey;
import com.ureca.gateway.idempotency.repository.IdempotencyKeyRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

/**
 * 조회 기반 멱등 가드 (기본 전략)
 * <p>
 * 확인(조회)과 기록(삽입)이 분리되어 원자적이지 않음
 * 같은 키가 동시에 들어오면 둘 다 FRESH 를 받을 수 있음 (at-most-mostly-once)
 * 더 강한 보장이 필요하면 atomic 또는 redis 전략 사용
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "gateway.idempotency", name = "strategy", havingValue = "lookup", matchIfMissing = true)
public class LookupIdempotencyGuard implements IdempotencyGuard {

    private final IdempotencyKeyRepository idempotencyKeyRepository;

    @Override
    public IdempotencyResult checkAndMark(String key) {
        if (idempotencyKeyRepository.existsById(key)) {
            log.info("[Idempotency] 중복 이벤트 감지. idempotencyKey: {}", key);
            return IdempotencyResult.DUPLICATE;
        }
        return IdempotencyResult.FRESH;
    }

    @Override
    public void recordProcessed(String key, String messageId) {
        try {
            idempotencyKeyRepository.save(IdempotencyKey.of(key, messageId));
        } catch (DataIntegrityViolationException e) {
            if (!idempotencyKeyRepository.existsById(key)) {
                // 키 중복이 아닌 제약 위반 (길이 초과 등)
                log.error("[Idempotency] 멱등 키 기록 실패. idempotencyKey: {}, error: {}", key, e.getMessage());
                throw e;
            }
            // 경쟁 구간에서 다른 요청이 먼저 기록함
            log.info("[Idempotency] 동시 처리로 이미 기록된 키. idempotencyKey: {}", key);
        }
    }
}
