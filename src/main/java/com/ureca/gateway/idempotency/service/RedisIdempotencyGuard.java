package com.ureca.gateway.idempotency.service;

import com.ureca.gateway.config.GatewayProperties;
import com.ureca.gateway.idempotency.entity.IdempotencyKey;
import com.ureca.gateway.idempotency.repository.IdempotencyKeyRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Redis SETNX 기반 멱등 가드 (강화 전략)
 * <p>
 * SET key NX EX ttl 로 선점한 요청만 FRESH
 * DB 레코드는 감사용으로 처리 후 기록
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "gateway.idempotency", name = "strategy", havingValue = "redis")
public class RedisIdempotencyGuard implements IdempotencyGuard {

    static final String KEY_PREFIX = "gateway:idempotency:";

    private final StringRedisTemplate redisTemplate;
    private final IdempotencyKeyRepository idempotencyKeyRepository;
    private final Duration ttl;

    public RedisIdempotencyGuard(
            StringRedisTemplate redisTemplate,
            IdempotencyKeyRepository idempotencyKeyRepository,
            GatewayProperties properties
    ) {
        this.redisTemplate = redisTemplate;
        this.idempotencyKeyRepository = idempotencyKeyRepository;
        this.ttl = properties.idempotency().redisTtl();
    }

    @Override
    public IdempotencyResult checkAndMark(String key) {
        Boolean acquired = redisTemplate.opsForValue().setIfAbsent(KEY_PREFIX + key, "1", ttl);

        if (!Boolean.TRUE.equals(acquired)) {
            log.info("[Idempotency] 중복 이벤트 감지 (Redis). idempotencyKey: {}", key);
            return IdempotencyResult.DUPLICATE;
        }
        return IdempotencyResult.FRESH;
    }

    @Override
    public void recordProcessed(String key, String messageId) {
        try {
            idempotencyKeyRepository.save(IdempotencyKey.of(key, messageId));
        } catch (DataIntegrityViolationException e) {
            log.info("[Idempotency] 이미 기록된 키. idempotencyKey: {}", key);
        }
    }
}
