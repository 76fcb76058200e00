package com.ureca.gateway.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * 비동기 처리를 위한 Executor 설정
 * <p>
 * Executor 분리 전략
 * 브로커 발행(재시도 포함)과 DLQ 재전송이 사용하는 발행 전용 풀
 * Slack 알림 풀
 */
@Slf4j
@Configuration
@EnableAsync
@EnableRetry
@EnableConfigurationProperties(GatewayProperties.class)
public class AsyncConfig {
    public static final String PUBLISH_EXECUTOR_NAME = "publishExecutor";
    public static final String NOTIFICATION_EXECUTOR_NAME = "notificationAsyncExecutor";

    /**
     * 브로커 발행 전용 Executor
     * <p>
     * 큐 용량을 제한해서 브로커 장애가 길어져도 메모리가 무한히 늘지 않음
     * 큐가 가득차면 AbortPolicy 로 거절 -> 호출자가 DLQ 로 넘김 (인입 스레드는 막지 않음)
     * 우아한 종료 : 배포 시 발행 중이던 작업 대기 10초 유예시간 부여
     */
    @Bean(name = PUBLISH_EXECUTOR_NAME)
    public ThreadPoolTaskExecutor publishExecutor(GatewayProperties properties) {
        GatewayProperties.Publisher publisher = properties.publisher();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(publisher.corePoolSize());
        executor.setMaxPoolSize(publisher.maxPoolSize());
        executor.setQueueCapacity(publisher.queueCapacity());
        executor.setThreadNamePrefix("Publish-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());

        executor.setWaitForTasksToCompleteOnShutdown(true);  // 작업 완료 대기
        executor.setAwaitTerminationSeconds(10);             // 최대 10초까지 대기

        executor.initialize();

        log.info("[비동기] Publish Executor 초기화 완료. core: {}, max: {}, queue: {}",
                publisher.corePoolSize(), publisher.maxPoolSize(), publisher.queueCapacity());
        return executor;
    }

    /**
     * Slack 알림 전용 Executor
     * <p>
     * 낮은 우선순위 의 부가기능과 알림 실패해도 전달에 영향 없어서
     * 큐의 사이즈도 줄이고 외부 API 호출로 시간 불확실을 독립적으로 실행
     */
    @Bean(name = NOTIFICATION_EXECUTOR_NAME)
    public Executor notificationAsyncExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(5);
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("Notification-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.DiscardPolicy());

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);

        executor.initialize();

        log.info("[비동기] Slack Executor 초기화 완료");
        return executor;
    }
}
