package com.ureca.gateway.bootstrap;

import com.ureca.gateway.GatewayApplication;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 저장소가 응답하지 않을 때 기동 순서 검증
 * <p>
 * schema.sql 실행, EntityManagerFactory 생성보다 연결 대기가 먼저 돌아야
 * 첫 연결 거부에서 바로 죽지 않고 백오프 재시도 후 DatastoreNotReadyException 으로 실패
 */
@ExtendWith(OutputCaptureExtension.class)
class ColdDatastoreStartupTest {

    @Test
    @DisplayName("연결 불가 DB : 재시도를 모두 소진한 뒤 DatastoreNotReadyException 으로 기동 실패")
    void start_UnreachableDatastore_RetriesBeforeFailing(CapturedOutput output) {
        SpringApplicationBuilder application = new SpringApplicationBuilder(GatewayApplication.class)
                .web(WebApplicationType.NONE)
                .profiles("test")
                .properties(
                        "spring.datasource.url=jdbc:mysql://127.0.0.1:1/gateway",
                        "spring.datasource.username=gateway",
                        "spring.datasource.password=gateway",
                        "spring.datasource.hikari.connection-timeout=250",
                        "gateway.bootstrap.max-attempts=3",
                        "gateway.bootstrap.initial-delay-ms=10",
                        "gateway.bootstrap.max-delay-ms=20"
                );

        assertThatThrownBy(application::run)
                .hasStackTraceContaining(DatastoreNotReadyException.class.getName());

        // 재시도 로그, 최종 실패 로그
        assertThat(output).contains("attempt: 2/3", "attempt: 3/3", "attempts: 3");
    }
}
