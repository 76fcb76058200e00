package com.ureca.gateway.dlq.scheduler;

import com.ureca.gateway.dlq.dto.DeadLetterStatistics;
import com.ureca.gateway.dlq.notification.DeadLetterAlertNotifier;
import com.ureca.gateway.dlq.service.DeadLetterQueue;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.*;

/**
 * DeadLetterMonitor 단위 테스트
 * <p>
 * 검증 목표:
 * - 상태별 Gauge 갱신
 * - 중복 알림 방지 (FAILED 개수 변화 감지)
 * - 0 건이 되면 기록 초기화
 */
@ExtendWith(MockitoExtension.class)
class DeadLetterMonitorTest {

    @Mock
    private DeadLetterQueue deadLetterQueue;

    @Mock
    private DeadLetterAlertNotifier alertNotifier;

    private SimpleMeterRegistry meterRegistry;

    private DeadLetterMonitor monitor;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        monitor = new DeadLetterMonitor(deadLetterQueue, alertNotifier, meterRegistry);
    }

    @Test
    @DisplayName("정상 : FAILED 존재 -> 알림 전송 + Gauge 갱신")
    void monitor_HasFailed_SendAlert() {
        // given
        DeadLetterStatistics current = statistics(3);
        given(deadLetterQueue.getStatistics()).willReturn(current);

        // when
        monitor.monitor();

        // then
        verify(alertNotifier, times(1)).notifyExhausted(current);

        assertThat(meterRegistry.get("gateway_dlq_entries").tag("status", "failed").gauge().value())
                .isEqualTo(3.0);
        assertThat(meterRegistry.get("gateway_dlq_entries").tag("status", "pending").gauge().value())
                .isEqualTo(2.0);
    }

    @Test
    @DisplayName("중복 방지 : 개수 동일 -> 알림 생략")
    void monitor_SameCount_NoAlert() {
        given(deadLetterQueue.getStatistics()).willReturn(statistics(3));

        monitor.monitor();
        monitor.monitor();

        verify(alertNotifier, times(1)).notifyExhausted(any());
    }

    @Test
    @DisplayName("개수 변화 : 알림 재전송")
    void monitor_CountChanged_SendAlert() {
        given(deadLetterQueue.getStatistics())
                .willReturn(statistics(3))
                .willReturn(statistics(4));

        monitor.monitor();
        monitor.monitor();

        verify(alertNotifier, times(2)).notifyExhausted(any());
    }

    @Test
    @DisplayName("0 건 : 기록 초기화 후 같은 개수가 다시 생기면 알림")
    void monitor_ZeroClearsMemo() {
        given(deadLetterQueue.getStatistics())
                .willReturn(statistics(3))
                .willReturn(statistics(0))
                .willReturn(statistics(3));

        monitor.monitor();
        monitor.monitor();
        monitor.monitor();

        verify(alertNotifier, times(2)).notifyExhausted(any());
    }

    @Test
    @DisplayName("예외 격리 : 통계 조회 실패해도 전파하지 않음")
    void monitor_Failure_Isolated() {
        given(deadLetterQueue.getStatistics()).willThrow(new IllegalStateException("db down"));

        monitor.monitor();

        verifyNoInteractions(alertNotifier);
    }

    private DeadLetterStatistics statistics(long failed) {
        return new DeadLetterStatistics(failed + 3, 2, failed, 1, 0);
    }
}
