package com.ureca.gateway.bootstrap;

import com.ureca.gateway.config.GatewayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.DependsOn;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 기동 시 DLQ 테이블 준비 확인
 * <p>
 * 연결 대기는 DatastoreConnectionWaiter 가 DB 초기화 전에 끝냄
 * 여기서는 테이블 생성(ddl-auto) 이후, 스케줄러 시작 전에 실행
 * 1. SELECT 1 로 연결 확인
 * 2. DLQ 조회/정리에 필요한 인덱스 확인, 없으면 생성
 * 최대 10회, 100ms 부터 2배씩 최대 5초 간격으로 재시도
 * 모두 실패하면 DatastoreNotReadyException -> 애플리케이션 기동 실패
 */
@Slf4j
@Component
@DependsOn("entityManagerFactory") // 테이블 생성(ddl-auto) 이후에 실행
public class DatastoreBootstrapper implements InitializingBean {

    static final String DLQ_TABLE = "dead_letter_queue";

    // 인덱스 이름 -> 컬럼
    static final Map<String, String> REQUIRED_INDEXES = new LinkedHashMap<>();

    static {
        REQUIRED_INDEXES.put("idx_dlq_status_next_retry", "status, next_retry_at");
        REQUIRED_INDEXES.put("idx_dlq_expires_at", "expires_at");
        REQUIRED_INDEXES.put("idx_dlq_created_at", "created_at");
        REQUIRED_INDEXES.put("idx_dlq_message_id", "message_id");
    }

    private static final String INDEX_EXISTS_SQL =
            "SELECT COUNT(*) FROM information_schema.statistics " +
                    "WHERE table_schema = DATABASE() AND table_name = ? AND index_name = ?";

    private final JdbcTemplate jdbcTemplate;
    private final RetryTemplate retryTemplate;
    private final int maxAttempts;

    @Autowired
    public DatastoreBootstrapper(JdbcTemplate jdbcTemplate, GatewayProperties properties) {
        this(jdbcTemplate, properties, new ThreadWaitSleeper());
    }

    DatastoreBootstrapper(JdbcTemplate jdbcTemplate, GatewayProperties properties, Sleeper sleeper) {
        this.jdbcTemplate = jdbcTemplate;
        this.maxAttempts = properties.bootstrap().maxAttempts();
        this.retryTemplate = BootstrapRetryTemplates.create(properties.bootstrap(), sleeper);
    }

    @Override
    public void afterPropertiesSet() {
        initialize();
    }

    /**
     * @throws DatastoreNotReadyException 모든 시도 실패
     */
    public void initialize() {
        try {
            retryTemplate.execute(context -> {
                int attempt = context.getRetryCount() + 1;
                if (attempt > 1) {
                    log.warn("[Bootstrap] 저장소 초기화 재시도. attempt: {}/{}, lastError: {}",
                            attempt, maxAttempts, context.getLastThrowable().getMessage());
                }
                ping();
                ensureIndexes();
                return null;
            });

            log.info("[Bootstrap] 저장소 준비 완료");

        } catch (RuntimeException e) {
            log.error("[Bootstrap] 저장소 초기화 최종 실패. attempts: {}, error: {}", maxAttempts, e.getMessage());
            throw new DatastoreNotReadyException(maxAttempts, e);
        }
    }

    private void ping() {
        jdbcTemplate.queryForObject("SELECT 1", Integer.class);
    }

    private void ensureIndexes() {
        REQUIRED_INDEXES.forEach((indexName, columns) -> {
            Integer count = jdbcTemplate.queryForObject(INDEX_EXISTS_SQL, Integer.class, DLQ_TABLE, indexName);

            if (count != null && count > 0) {
                return;
            }

            jdbcTemplate.execute("CREATE INDEX " + indexName + " ON " + DLQ_TABLE + " (" + columns + ")");
            log.info("[Bootstrap] 인덱스 생성. table: {}, index: {}, columns: {}", DLQ_TABLE, indexName, columns);
        });
    }
}
