package com.ureca.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Map;

/**
 * 게이트웨이 설정 (application.yml 의 gateway.*)
 * <p>
 * publisher 와 dlq 백오프는 서로 독립적으로 조정
 * publisher : 프로세스 내 즉시 재시도
 * dlq : 대역 외 복구 스케줄링
 */
@ConfigurationProperties(prefix = "gateway")
public record GatewayProperties(
        Broker broker,
        Publisher publisher,
        DeadLetter dlq,
        Bootstrap bootstrap,
        Routing routing,
        Idempotency idempotency
) {
    public record Broker(
            String url,
            String source,
            Duration connectTimeout,
            Duration readTimeout
    ) {
    }

    public record Publisher(
            int maxAttempts,
            long baseDelayMs,
            long maxDelayMs,
            long jitterMs,
            int corePoolSize,
            int maxPoolSize,
            int queueCapacity
    ) {
    }

    public record DeadLetter(
            int maxRetries,
            long backoffBaseMs,
            double backoffMultiplier,
            long backoffCapMs,
            Duration ttl,
            int retryBatchSize,
            int cleanupBatchSize
    ) {
    }

    public record Bootstrap(
            int maxAttempts,
            long initialDelayMs,
            long maxDelayMs
    ) {
    }

    public record Routing(
            String defaultAgentId,
            Map<String, String> keywordAgents
    ) {
        public Map<String, String> keywordAgents() {
            return keywordAgents == null ? Map.of() : keywordAgents;
        }
    }

    public record Idempotency(
            String strategy,
            Duration redisTtl
    ) {
    }
}
