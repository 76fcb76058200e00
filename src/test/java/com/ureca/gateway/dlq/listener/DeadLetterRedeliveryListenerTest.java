package com.ureca.gateway.dlq.listener;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ureca.gateway.dlq.entity.DeadLetterEntry;
import com.ureca.gateway.dlq.entity.FailedMessage;
import com.ureca.gateway.dlq.event.DeadLetterRetryEvent;
import com.ureca.gateway.dlq.exception.DeadLetterEntryNotFoundException;
import com.ureca.gateway.dlq.fixture.DeadLetterFixture;
import com.ureca.gateway.dlq.service.DeadLetterQueue;
import com.ureca.gateway.publish.dto.OutboundEvent;
import com.ureca.gateway.publish.exception.BrokerPublishException;
import com.ureca.gateway.publish.service.OutboundEventSerializer;
import com.ureca.gateway.publish.service.RetryingBrokerPublisher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * DeadLetterRedeliveryListener 단위 테스트
 * <p>
 * 검증 제외:
 * - @Async 실행 스레드 (Spring 의 책임)
 */
@ExtendWith(MockitoExtension.class)
class DeadLetterRedeliveryListenerTest {

    @Mock
    private DeadLetterQueue deadLetterQueue;

    @Mock
    private RetryingBrokerPublisher retryingBrokerPublisher;

    private DeadLetterRedeliveryListener listener;

    @BeforeEach
    void setUp() {
        listener = new DeadLetterRedeliveryListener(
                deadLetterQueue, retryingBrokerPublisher, new OutboundEventSerializer(new ObjectMapper()));
    }

    @Test
    @DisplayName("정상 : 저장된 payload 를 새 이벤트 ID 로 한 번 발행 후 RESOLVED")
    void redeliver_Success() {
        // given
        DeadLetterEntry entry = DeadLetterFixture.due("k1");
        given(deadLetterQueue.findById(entry.getId())).willReturn(entry);

        // when
        listener.redeliver(new DeadLetterRetryEvent(entry.getId(), 0));

        // then
        ArgumentCaptor<OutboundEvent> captor = ArgumentCaptor.forClass(OutboundEvent.class);
        verify(retryingBrokerPublisher).publishOnce(captor.capture());

        OutboundEvent redelivered = captor.getValue();
        assertThat(redelivered.id()).isNotEqualTo("evt-1");
        assertThat(redelivered.type()).isEqualTo("agent.message");
        assertThat(redelivered.agentid()).isEqualTo("agent-bruno");
        assertThat(redelivered.data().path("idempotency_key").asText()).isEqualTo("k1");

        verify(deadLetterQueue).recordRedeliverySuccess(entry.getId());
        verify(deadLetterQueue, never()).recordRedeliveryFailure(anyString(), anyInt(), any());
    }

    @Test
    @DisplayName("실패 : 발행 실패 -> 선점 시점 재시도 횟수로 실패 반영")
    void redeliver_PublishFails_RecordsFailure() {
        // given
        DeadLetterEntry entry = DeadLetterFixture.pending("k1", 2, LocalDateTime.now().minusHours(1));
        given(deadLetterQueue.findById(entry.getId())).willReturn(entry);
        willThrow(new BrokerPublishException(503, "Broker returned status 503: busy"))
                .given(retryingBrokerPublisher).publishOnce(any());

        // when
        listener.redeliver(new DeadLetterRetryEvent(entry.getId(), 2));

        // then
        verify(deadLetterQueue).recordRedeliveryFailure(entry.getId(), 2, "Broker returned status 503: busy");
        verify(deadLetterQueue, never()).recordRedeliverySuccess(any());
    }

    @Test
    @DisplayName("실패 : payload 가 비어 있으면 발행 없이 실패 반영")
    void redeliver_MissingPayload_RecordsFailure() {
        // given
        DeadLetterEntry entry = DeadLetterEntry.create(
                FailedMessage.builder().idempotencyKey("k1").build(),
                "boom", null, 0, DeadLetterFixture.POLICY, LocalDateTime.now());
        given(deadLetterQueue.findById(entry.getId())).willReturn(entry);

        // when
        listener.redeliver(new DeadLetterRetryEvent(entry.getId(), 0));

        // then
        verify(retryingBrokerPublisher, never()).publishOnce(any());
        verify(deadLetterQueue).recordRedeliveryFailure(anyString(), anyInt(), anyString());
    }

    @Test
    @DisplayName("예외 : 항목이 사라졌으면 실패 반영 시도 (조건부 업데이트라 무해)")
    void redeliver_EntryGone() {
        given(deadLetterQueue.findById("gone")).willThrow(new DeadLetterEntryNotFoundException("gone"));

        listener.redeliver(new DeadLetterRetryEvent("gone", 1));

        verify(retryingBrokerPublisher, never()).publishOnce(any());
        verify(deadLetterQueue).recordRedeliveryFailure(anyString(), anyInt(), any());
    }
}
