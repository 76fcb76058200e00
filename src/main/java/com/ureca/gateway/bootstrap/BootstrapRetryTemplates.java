package com.ureca.gateway.bootstrap;

import com.ureca.gateway.config.GatewayProperties;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

/**
 * 기동 단계 재시도 설정
 * 연결 대기와 인덱스 준비가 같은 백오프(100ms 부터 2배, 최대 5초)를 사용
 */
final class BootstrapRetryTemplates {

    private BootstrapRetryTemplates() {
    }

    static RetryTemplate create(GatewayProperties.Bootstrap bootstrap, Sleeper sleeper) {
        ExponentialBackOffPolicy backOffPolicy = new ExponentialBackOffPolicy();
        backOffPolicy.setInitialInterval(bootstrap.initialDelayMs());
        backOffPolicy.setMultiplier(2.0);
        backOffPolicy.setMaxInterval(bootstrap.maxDelayMs());
        backOffPolicy.setSleeper(sleeper);

        RetryTemplate retryTemplate = new RetryTemplate();
        retryTemplate.setRetryPolicy(new SimpleRetryPolicy(bootstrap.maxAttempts()));
        retryTemplate.setBackOffPolicy(backOffPolicy);
        return retryTemplate;
    }
}
