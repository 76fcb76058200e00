package com.ureca.gateway.support;

import com.ureca.gateway.dlq.notification.DeadLetterAlertNotifier;
import com.ureca.gateway.dlq.repository.DeadLetterEntryRepository;
import com.ureca.gateway.idempotency.repository.IdempotencyKeyRepository;
import com.ureca.gateway.routing.repository.ConversationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

/**
 * 통합 테스트 추상 부모 클래스
 * <p>
 * MySQL Testcontainers (Docker 가 없으면 건너뜀)
 * 외부 서비스 Mock (Slack)
 * 브로커 URL 은 아무도 듣지 않는 포트라 모든 발행 시도가 연결 실패
 *
 * @BeforeEach 로 cleanup() 보장
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
public abstract class IntegrationTestSupport {

    @Container
    protected static final MySQLContainer<?> mysql =
            new MySQLContainer<>(DockerImageName.parse("mysql:8.0"))
                    .withDatabaseName("testdb")
                    .withUsername("test")
                    .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", mysql::getJdbcUrl);
        registry.add("spring.datasource.username", mysql::getUsername);
        registry.add("spring.datasource.password", mysql::getPassword);
    }

    // 외부 서비스 Mock
    @MockitoBean
    protected DeadLetterAlertNotifier alertNotifier;

    @Autowired
    protected DeadLetterEntryRepository deadLetterEntryRepository;

    @Autowired
    protected IdempotencyKeyRepository idempotencyKeyRepository;

    @Autowired
    protected ConversationRepository conversationRepository;

    @BeforeEach
    void cleanup() {
        deadLetterEntryRepository.deleteAllInBatch();
        idempotencyKeyRepository.deleteAllInBatch();
        conversationRepository.deleteAllInBatch();
    }
}
