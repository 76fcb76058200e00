package com.ureca.gateway.dlq.scheduler;

import com.ureca.gateway.dlq.service.DeadLetterQueue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class DeadLetterCleanupSchedulerTest {

    @InjectMocks
    private DeadLetterCleanupScheduler scheduler;

    @Mock
    private DeadLetterQueue deadLetterQueue;

    @Test
    @DisplayName("정상 : 만료 정리 위임")
    void cleanupExpiredEntries() {
        given(deadLetterQueue.cleanupExpired()).willReturn(1500);

        scheduler.cleanupExpiredEntries();

        verify(deadLetterQueue).cleanupExpired();
    }

    @Test
    @DisplayName("예외 격리 : 정리 실패는 다음 스케줄로")
    void cleanupExpiredEntries_Failure_Isolated() {
        given(deadLetterQueue.cleanupExpired()).willThrow(new IllegalStateException("db down"));

        assertThatCode(() -> scheduler.cleanupExpiredEntries()).doesNotThrowAnyException();
    }
}
