package com.ureca.gateway.dlq.scheduler;

import com.ureca.gateway.dlq.dto.DeadLetterStatistics;
import com.ureca.gateway.dlq.entity.DeadLetterStatus;
import com.ureca.gateway.dlq.notification.DeadLetterAlertNotifier;
import com.ureca.gateway.dlq.service.DeadLetterQueue;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * DLQ 모니터링
 * <p>
 * 주기적으로 상태별 항목 수를 Gauge 로 노출
 * FAILED(재시도 소진) 개수가 바뀌었을 때만 Slack 알림 (중복 방지)
 * 0 이 되면 기록 초기화
 */
@Slf4j
@Component
public class DeadLetterMonitor {

    private final DeadLetterQueue deadLetterQueue;
    private final DeadLetterAlertNotifier alertNotifier;

    private final Map<DeadLetterStatus, AtomicLong> gaugeValues = new EnumMap<>(DeadLetterStatus.class);

    // 마지막으로 알림 보낸 FAILED 개수 (null 이면 알림 이력 없음)
    private volatile Long lastAlertedFailedCount;

    public DeadLetterMonitor(
            DeadLetterQueue deadLetterQueue,
            DeadLetterAlertNotifier alertNotifier,
            MeterRegistry meterRegistry
    ) {
        this.deadLetterQueue = deadLetterQueue;
        this.alertNotifier = alertNotifier;

        for (DeadLetterStatus status : DeadLetterStatus.values()) {
            AtomicLong value = new AtomicLong(0);
            Gauge.builder("gateway_dlq_entries", value, AtomicLong::get)
                    .tag("status", status.name().toLowerCase())
                    .register(meterRegistry);
            gaugeValues.put(status, value);
        }
    }

    @Scheduled(fixedDelayString = "${gateway.dlq.monitor.interval}")
    public void monitor() {
        try {
            DeadLetterStatistics statistics = deadLetterQueue.getStatistics();

            gaugeValues.get(DeadLetterStatus.PENDING).set(statistics.pending());
            gaugeValues.get(DeadLetterStatus.RETRYING).set(statistics.retrying());
            gaugeValues.get(DeadLetterStatus.FAILED).set(statistics.failed());
            gaugeValues.get(DeadLetterStatus.RESOLVED).set(statistics.resolved());

            checkAndAlert(statistics);

        } catch (Exception e) {
            log.error("[DLQ 모니터링] 실패", e);
        }
    }

    private void checkAndAlert(DeadLetterStatistics statistics) {
        long failedCount = statistics.failed();

        if (failedCount == 0) {
            lastAlertedFailedCount = null;
            return;
        }

        if (lastAlertedFailedCount != null && lastAlertedFailedCount == failedCount) {
            log.debug("[DLQ 알림 생략] failed: {} (변화 없음)", failedCount);
            return;
        }

        log.warn("[DLQ 감지] failed: {}, pending: {}, retrying: {}",
                failedCount, statistics.pending(), statistics.retrying());

        alertNotifier.notifyExhausted(statistics);
        lastAlertedFailedCount = failedCount;
    }
}
