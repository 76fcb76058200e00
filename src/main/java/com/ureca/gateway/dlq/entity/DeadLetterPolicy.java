package com.ureca.gateway.dlq.entity;

import com.ureca.gateway.config.GatewayProperties;

import java.time.Duration;

/**
 * DLQ 재시도 정책
 * <p>
 * 백오프 : min(base * multiplier^retryCount, cap) 밀리초
 * 기본값 base 100, multiplier 2.0, cap 300000 (5분), 최대 5회, 보관 7일
 *
 * @param maxRetries        최대 재시도 횟수
 * @param backoffBaseMs     기본 지연
 * @param backoffMultiplier 지수 배수
 * @param backoffCapMs      지연 상한
 * @param ttl               보관 기간 (만료 시 정리 대상)
 */
public record DeadLetterPolicy(
        int maxRetries,
        long backoffBaseMs,
        double backoffMultiplier,
        long backoffCapMs,
        Duration ttl
) {
    public static DeadLetterPolicy from(GatewayProperties.DeadLetter dlq) {
        return new DeadLetterPolicy(
                dlq.maxRetries(),
                dlq.backoffBaseMs(),
                dlq.backoffMultiplier(),
                dlq.backoffCapMs(),
                dlq.ttl()
        );
    }

    public long backoffMillis(int retryCount) {
        double delay = backoffBaseMs * Math.pow(backoffMultiplier, retryCount);
        // 큰 retryCount 에서 double 오버플로우(Infinity) 되어도 cap 으로 수렴
        return (long) Math.min(delay, backoffCapMs);
    }

    public boolean isExhausted(int retryCount) {
        return retryCount >= maxRetries;
    }
}
