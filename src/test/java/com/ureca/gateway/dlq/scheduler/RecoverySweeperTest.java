package com.ureca.gateway.dlq.scheduler;

import com.ureca.gateway.dlq.service.DeadLetterQueue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * RecoverySweeper 단위 테스트
 * <p>
 * 검증 제외:
 * - @Scheduled, @SchedulerLock (Spring, ShedLock 의 책임)
 */
@ExtendWith(MockitoExtension.class)
class RecoverySweeperTest {

    @InjectMocks
    private RecoverySweeper recoverySweeper;

    @Mock
    private DeadLetterQueue deadLetterQueue;

    @Test
    @DisplayName("정상 : 스윕마다 재시도 선점 호출")
    void sweep_DelegatesToQueue() {
        given(deadLetterQueue.retryPendingMessages()).willReturn(3);

        recoverySweeper.sweep();
        recoverySweeper.sweep();

        verify(deadLetterQueue, times(2)).retryPendingMessages();
    }

    @Test
    @DisplayName("예외 격리 : 저장소 오류가 나도 스케줄러로 전파되지 않음")
    void sweep_Failure_Isolated() {
        given(deadLetterQueue.retryPendingMessages())
                .willThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatCode(() -> recoverySweeper.sweep()).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("종료 : 종료 요청 이후 스윕하지 않음")
    void sweep_AfterShutdown_Skipped() {
        recoverySweeper.shutdown();

        recoverySweeper.sweep();

        verify(deadLetterQueue, never()).retryPendingMessages();
    }
}
