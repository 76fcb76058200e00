package com.ureca.gateway.dlq.scheduler;

import com.ureca.gateway.dlq.service.DeadLetterQueue;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * DLQ 복구 스윕
 * <p>
 * 재시도 시각이 도래한 PENDING 항목을 주기적으로 선점하고 재전송 신호 발행
 * ShedLock 으로 한 인스턴스만 실행, 락이 없어도 조건부 선점이라 중복 재전송은 없음
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RecoverySweeper {

    private final DeadLetterQueue deadLetterQueue;

    // 종료 요청 플래그
    private final AtomicBoolean shutdownRequested = new AtomicBoolean(false);

    @PreDestroy
    public void shutdown() {
        if (shutdownRequested.compareAndSet(false, true)) {
            log.info("[DLQ Sweeper] 종료 요청. 새 스윕을 시작하지 않습니다.");
        }
    }

    @Scheduled(fixedDelayString = "${gateway.dlq.sweeper.fixed-delay-ms}")
    @SchedulerLock(name = "dlqRecoverySweep", lockAtMostFor = "PT1M")
    public void sweep() {
        if (shutdownRequested.get()) {
            log.debug("[DLQ Sweeper] 종료 요청됨. 스윕 건너뜀.");
            return;
        }

        try {
            int claimed = deadLetterQueue.retryPendingMessages();

            if (claimed > 0) {
                log.info("[DLQ Sweeper] 재전송 대상 {} 건 선점", claimed);
            }
        } catch (Exception e) {
            log.error("[DLQ Sweeper] 스윕 실패. 다음 주기에 재시도. error: {}", e.getMessage(), e);
        }
    }
}
