package com.ureca.gateway.ingest.service;

import com.ureca.gateway.idempotency.repository.IdempotencyKeyRepository;
import com.ureca.gateway.idempotency.service.AtomicInsertIdempotencyGuard;
import com.ureca.gateway.idempotency.service.IdempotencyGuard;
import com.ureca.gateway.idempotency.service.LookupIdempotencyGuard;
import com.ureca.gateway.publish.service.PublishDispatcher;
import com.ureca.gateway.routing.service.RoutingResolver;
import com.ureca.gateway.support.RepositoryTestSupport;
import com.ureca.gateway.support.fixture.EventFixture;
import com.ureca.gateway.support.fixture.GatewayPropertiesFixture;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.concurrent.atomic.AtomicInteger;

import static com.ureca.gateway.support.ConcurrentRunner.runConcurrently;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willAnswer;
import static org.mockito.Mockito.mock;

/**
 * 같은 멱등 키가 동시에 들어올 때 발행 횟수
 * <p>
 * lookup : 확인과 기록이 분리되어 있어 1 ~ N 회 (중복 허용 구간 존재), 키 기록은 1건
 * atomic : 선삽입으로 정확히 1회
 */
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class MessageIngestionConcurrencyTest extends RepositoryTestSupport {

    private static final int THREAD_COUNT = 20;

    @Autowired
    private IdempotencyKeyRepository idempotencyKeyRepository;

    private final AtomicInteger dispatched = new AtomicInteger();

    private RoutingResolver routingResolver;

    private PublishDispatcher publishDispatcher;

    @BeforeEach
    void setUp() {
        routingResolver = mock(RoutingResolver.class);
        publishDispatcher = mock(PublishDispatcher.class);

        given(routingResolver.resolve(any())).willReturn(GatewayPropertiesFixture.DEFAULT_AGENT);
        willAnswer(invocation -> dispatched.incrementAndGet())
                .given(publishDispatcher).dispatch(any(), any());
    }

    @AfterEach
    void tearDown() {
        idempotencyKeyRepository.deleteAllInBatch();
    }

    private MessageIngestionService serviceWith(IdempotencyGuard guard) {
        return new MessageIngestionService(
                guard, routingResolver, publishDispatcher, new SimpleMeterRegistry(), GatewayPropertiesFixture.defaults());
    }

    @Test
    @DisplayName("lookup : 동시 중복은 1 ~ N 회 발행, 멱등 키는 1건만 기록")
    void ingest_Lookup_BoundedDuplicates() throws InterruptedException {
        // given
        MessageIngestionService service = serviceWith(new LookupIdempotencyGuard(idempotencyKeyRepository));

        // when
        runConcurrently(() -> service.ingest(EventFixture.messageReceived("k-race", "c1")), THREAD_COUNT);

        // then
        assertThat(dispatched.get()).isBetween(1, THREAD_COUNT);
        assertThat(idempotencyKeyRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("atomic : 동시 중복이어도 정확히 1회 발행")
    void ingest_Atomic_ExactlyOnce() throws InterruptedException {
        // given
        MessageIngestionService service = serviceWith(new AtomicInsertIdempotencyGuard(idempotencyKeyRepository));

        // when
        runConcurrently(() -> service.ingest(EventFixture.messageReceived("k-race", "c1")), THREAD_COUNT);

        // then
        assertThat(dispatched.get()).isEqualTo(1);
        assertThat(idempotencyKeyRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("lookup : 이미 처리된 키는 동시에 다시 와도 발행 없음")
    void ingest_Lookup_AlreadyRecorded_NoDispatch() throws InterruptedException {
        // given
        MessageIngestionService service = serviceWith(new LookupIdempotencyGuard(idempotencyKeyRepository));
        service.ingest(EventFixture.messageReceived("k-done", "c1"));
        dispatched.set(0);

        // when
        runConcurrently(() -> service.ingest(EventFixture.messageReceived("k-done", "c1")), THREAD_COUNT);

        // then
        assertThat(dispatched.get()).isZero();
    }
}
