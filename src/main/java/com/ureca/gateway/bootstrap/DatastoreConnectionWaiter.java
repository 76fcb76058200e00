package com.ureca.gateway.bootstrap;

import com.ureca.gateway.config.GatewayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;

/**
 * 데이터 저장소 연결 대기
 * <p>
 * schema.sql 실행과 EntityManagerFactory 생성보다 먼저 실행 (DatastoreConnectionOrderConfig 에서 의존 관계 등록)
 * DB 가 늦게 뜨는 환경에서 첫 연결 거부로 기동이 바로 실패하지 않도록
 * JdbcTemplate 빈은 DB 초기화 이후로 정렬되므로 DataSource 로 직접 생성
 */
@Slf4j
@Component(DatastoreConnectionWaiter.BEAN_NAME)
public class DatastoreConnectionWaiter implements InitializingBean {

    public static final String BEAN_NAME = "datastoreConnectionWaiter";

    private final JdbcTemplate jdbcTemplate;
    private final RetryTemplate retryTemplate;
    private final int maxAttempts;

    @Autowired
    public DatastoreConnectionWaiter(DataSource dataSource, GatewayProperties properties) {
        this(new JdbcTemplate(dataSource), properties, new ThreadWaitSleeper());
    }

    DatastoreConnectionWaiter(JdbcTemplate jdbcTemplate, GatewayProperties properties, Sleeper sleeper) {
        this.jdbcTemplate = jdbcTemplate;
        this.maxAttempts = properties.bootstrap().maxAttempts();
        this.retryTemplate = BootstrapRetryTemplates.create(properties.bootstrap(), sleeper);
    }

    @Override
    public void afterPropertiesSet() {
        awaitConnection();
    }

    /**
     * @throws DatastoreNotReadyException 모든 시도 실패
     */
    public void awaitConnection() {
        try {
            retryTemplate.execute(context -> {
                int attempt = context.getRetryCount() + 1;
                if (attempt > 1) {
                    log.warn("[Bootstrap] 저장소 연결 재시도. attempt: {}/{}, lastError: {}",
                            attempt, maxAttempts, context.getLastThrowable().getMessage());
                }
                return jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            });

            log.info("[Bootstrap] 저장소 연결 확인");

        } catch (RuntimeException e) {
            log.error("[Bootstrap] 저장소 연결 최종 실패. attempts: {}, error: {}", maxAttempts, e.getMessage());
            throw new DatastoreNotReadyException(maxAttempts, e);
        }
    }
}
