package com.ureca.gateway.dlq.scheduler;

import com.ureca.gateway.dlq.service.DeadLetterQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * DLQ 만료 항목 정리 스케줄러
 * <p>
 * expires_at 이 지난 항목을 상태와 무관하게 배치 삭제
 * MySQL 에는 TTL 인덱스가 없어서 이 스케줄러가 만료 처리를 담당
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DeadLetterCleanupScheduler {

    private final DeadLetterQueue deadLetterQueue;

    @Scheduled(cron = "${gateway.dlq.cleanup.cron}")
    @SchedulerLock(name = "dlqCleanup", lockAtMostFor = "PT10M", lockAtLeastFor = "PT1M")
    public void cleanupExpiredEntries() {
        log.info("[DLQ Cleanup] 정리 시작");

        try {
            int deleted = deadLetterQueue.cleanupExpired();
            log.info("[DLQ Cleanup] 정리 완료. 총 삭제된 항목 수: {}", deleted);
        } catch (Exception e) {
            log.error("[DLQ Cleanup] 정리 실패. 다음 스케줄에 재시도. error: {}", e.getMessage());
        }
    }
}
