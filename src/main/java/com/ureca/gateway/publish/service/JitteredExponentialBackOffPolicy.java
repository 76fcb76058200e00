package com.ureca.gateway.publish.service;

import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;

import java.util.concurrent.ThreadLocalRandom;

/**
 * 지터가 붙은 지수 백오프
 * <p>
 * k 번째 재시도 전 대기 : min(base * 2^(k-1), cap) + [0, jitter) 밀리초
 * 기본값 base 100, cap 30000, jitter 50 -> 100, 200, 400, 800 ... (+0~49)
 * 스프링의 ExponentialRandomBackOffPolicy 는 배수에 곱하는 방식이라 상한 뒤에 더하는 지터를 직접 구현
 */
public class JitteredExponentialBackOffPolicy implements BackOffPolicy {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final long jitterMs;
    private final Sleeper sleeper;

    public JitteredExponentialBackOffPolicy(long baseDelayMs, long maxDelayMs, long jitterMs) {
        this(baseDelayMs, maxDelayMs, jitterMs, new ThreadWaitSleeper());
    }

    public JitteredExponentialBackOffPolicy(long baseDelayMs, long maxDelayMs, long jitterMs, Sleeper sleeper) {
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterMs = jitterMs;
        this.sleeper = sleeper;
    }

    @Override
    public BackOffContext start(RetryContext context) {
        return new JitterBackOffContext();
    }

    @Override
    public void backOff(BackOffContext backOffContext) throws BackOffInterruptedException {
        JitterBackOffContext context = (JitterBackOffContext) backOffContext;
        long delay = delayBeforeRetry(++context.retries);

        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackOffInterruptedException("발행 재시도 대기 중 인터럽트", e);
        }
    }

    /**
     * 지터를 제외한 지연
     *
     * @param retry 1 부터 시작하는 재시도 번호
     */
    long exponentialDelay(int retry) {
        double delay = baseDelayMs * Math.pow(2, Math.max(0, retry - 1));
        return (long) Math.min(delay, maxDelayMs);
    }

    long delayBeforeRetry(int retry) {
        long jitter = jitterMs > 0 ? ThreadLocalRandom.current().nextLong(jitterMs) : 0L;
        return exponentialDelay(retry) + jitter;
    }

    private static class JitterBackOffContext implements BackOffContext {
        private int retries;
    }
}
