package com.ureca.gateway.dlq.service;

import com.ureca.gateway.config.GatewayProperties;
import com.ureca.gateway.dlq.dto.DeadLetterStatistics;
import com.ureca.gateway.dlq.entity.*;
import com.ureca.gateway.dlq.event.DeadLetterRetryEvent;
import com.ureca.gateway.dlq.exception.DeadLetterEntryNotFoundException;
import com.ureca.gateway.dlq.repository.DeadLetterEntryRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Dead Letter Queue
 * <p>
 * 전달에 실패한 메시지를 보관하고 재시도 일정을 관리
 * 상태 전이 : PENDING -> RETRYING -> (RESOLVED | PENDING | FAILED), 어떤 상태든 -> RESOLVED (운영자)
 * 상태 변경은 모두 조건부 UPDATE 로 처리해서 여러 인스턴스가 동시에 돌아도 안전
 * 삭제는 만료 정리(cleanupExpired)로만
 */
@Slf4j
@Service
public class DeadLetterQueue {

    static final String REDELIVERED_REASON = "redelivered";

    private final DeadLetterEntryRepository deadLetterEntryRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final DeadLetterPolicy policy;
    private final int retryBatchSize;
    private final int cleanupBatchSize;

    public DeadLetterQueue(
            DeadLetterEntryRepository deadLetterEntryRepository,
            ApplicationEventPublisher eventPublisher,
            GatewayProperties properties
    ) {
        this.deadLetterEntryRepository = deadLetterEntryRepository;
        this.eventPublisher = eventPublisher;
        this.policy = DeadLetterPolicy.from(properties.dlq());
        this.retryBatchSize = properties.dlq().retryBatchSize();
        this.cleanupBatchSize = properties.dlq().cleanupBatchSize();
    }

    /**
     * 실패 메시지 등록
     *
     * @param message    실패 맥락 (재전송 payload 포함)
     * @param error      마지막 에러
     * @param errorType  실패 분류
     * @param retryCount 이미 시도한 횟수 (최대치 이상이면 바로 FAILED)
     * @return 생성된 DLQ ID
     */
    @Transactional
    public String add(FailedMessage message, String error, DeadLetterErrorType errorType, int retryCount) {
        DeadLetterEntry entry = DeadLetterEntry.create(
                message, error, errorType, retryCount, policy, LocalDateTime.now());

        deadLetterEntryRepository.save(entry);

        if (entry.isRetryable()) {
            log.warn("[DLQ] 항목 등록. 재시도 예약. dlqId: {}, idempotencyKey: {}, errorType: {}, retryCount: {}, nextRetryAt: {}",
                    entry.getId(), message.getIdempotencyKey(), errorType,
                    entry.getRetryCount(), entry.getNextRetryAt());
        } else {
            log.error("[DLQ] 항목 등록. 재시도 소진, 운영자 확인 필요. dlqId: {}, idempotencyKey: {}, errorType: {}, retryCount: {}",
                    entry.getId(), message.getIdempotencyKey(), errorType, entry.getRetryCount());
        }

        return entry.getId();
    }

    /**
     * 재시도 시각이 도래한 항목을 선점하고 재전송 신호 발행
     * <p>
     * 조회와 선점을 분리 : 조회는 후보만 뽑고 선점은 항목별 조건부 UPDATE
     * 다른 인스턴스가 먼저 선점한 항목은 0 이 반환되어 건너뜀
     *
     * @return 이번 호출에서 선점한 항목 수
     */
    public int retryPendingMessages() {
        LocalDateTime now = LocalDateTime.now();

        List<String> dueIds = deadLetterEntryRepository.findDueIds(
                DeadLetterStatus.PENDING,
                now,
                PageRequest.of(0, retryBatchSize)
        );

        if (dueIds.isEmpty()) {
            return 0;
        }

        int claimed = 0;
        for (String id : dueIds) {
            int updated = deadLetterEntryRepository.claimForRetry(
                    id, DeadLetterStatus.PENDING, DeadLetterStatus.RETRYING, now);

            if (updated == 0) {
                log.debug("[DLQ] 이미 선점됨 또는 대상 아님. dlqId: {}", id);
                continue;
            }

            claimed++;
            signalRetry(id);
        }

        log.info("[DLQ] 재시도 선점 완료. 후보: {}, 선점: {}", dueIds.size(), claimed);
        return claimed;
    }

    // 재전송 리스너는 발행 풀에서 비동기로 실행, 풀이 가득 차면 선점을 되돌려 다음 스윕에 맡김
    private void signalRetry(String id) {
        deadLetterEntryRepository.findById(id).ifPresent(entry -> {
            try {
                eventPublisher.publishEvent(new DeadLetterRetryEvent(id, entry.getRetryCount()));
            } catch (TaskRejectedException e) {
                releaseClaim(id);
            }
        });
    }

    /**
     * 상태별 최신순 조회
     *
     * @param status 조회할 상태
     * @param limit  최대 건수 (null 이면 전체)
     */
    @Transactional(readOnly = true)
    public List<DeadLetterEntry> getEntriesByStatus(DeadLetterStatus status, Integer limit) {
        Pageable pageable = limit == null ? Pageable.unpaged() : PageRequest.of(0, limit);
        return deadLetterEntryRepository.findByStatusOrderByCreatedAtDesc(status, pageable);
    }

    @Transactional(readOnly = true)
    public DeadLetterEntry findById(String id) {
        return deadLetterEntryRepository.findById(id)
                .orElseThrow(() -> new DeadLetterEntryNotFoundException(id));
    }

    /**
     * 운영자 해결 처리
     * 어떤 상태에서든 가능하고 이미 RESOLVED 면 사유/시각을 덮어씀
     *
     * @throws DeadLetterEntryNotFoundException 존재하지 않는 ID
     */
    public void markResolved(String id, String reason) {
        int updated = deadLetterEntryRepository.markResolved(
                id, DeadLetterStatus.RESOLVED, reason, LocalDateTime.now());

        if (updated == 0) {
            throw new DeadLetterEntryNotFoundException(id);
        }

        log.info("[DLQ] 해결 처리 완료. dlqId: {}, reason: {}", id, reason);
    }

    /**
     * 만료된 항목 배치 삭제 (상태 무관)
     *
     * @return 삭제된 총 건수
     */
    public int cleanupExpired() {
        LocalDateTime now = LocalDateTime.now();
        int totalDeleted = 0;
        int deleted;

        do {
            deleted = deadLetterEntryRepository.deleteExpired(now, cleanupBatchSize);
            totalDeleted += deleted;
        } while (deleted == cleanupBatchSize);

        if (totalDeleted > 0) {
            log.info("[DLQ] 만료 항목 정리 완료. 삭제 건수: {}", totalDeleted);
        }
        return totalDeleted;
    }

    @Transactional(readOnly = true)
    public DeadLetterStatistics getStatistics() {
        return new DeadLetterStatistics(
                deadLetterEntryRepository.count(),
                deadLetterEntryRepository.countByStatus(DeadLetterStatus.PENDING),
                deadLetterEntryRepository.countByStatus(DeadLetterStatus.FAILED),
                deadLetterEntryRepository.countByStatus(DeadLetterStatus.RETRYING),
                deadLetterEntryRepository.countByStatus(DeadLetterStatus.RESOLVED)
        );
    }

    /**
     * 재전송 성공 RETRYING -> RESOLVED
     */
    public void recordRedeliverySuccess(String id) {
        int updated = deadLetterEntryRepository.markRedelivered(
                id, DeadLetterStatus.RETRYING, DeadLetterStatus.RESOLVED,
                REDELIVERED_REASON, LocalDateTime.now());

        if (updated == 0) {
            log.info("[DLQ] 재전송 성공 반영 생략 (RETRYING 아님). dlqId: {}", id);
        } else {
            log.info("[DLQ] 재전송 성공. dlqId: {}", id);
        }
    }

    /**
     * 재전송 실패 반영
     * 시도 횟수 +1, 최대치 도달하면 FAILED 아니면 백오프 후 PENDING
     *
     * @param id                 DLQ ID
     * @param expectedRetryCount 선점 시점의 재시도 횟수
     * @param error              실패 원인
     */
    public void recordRedeliveryFailure(String id, int expectedRetryCount, String error) {
        int nextRetryCount = expectedRetryCount + 1;
        String message = DeadLetterEntry.errorMessage(error);

        if (policy.isExhausted(nextRetryCount)) {
            int updated = deadLetterEntryRepository.markRedeliveryExhausted(
                    id, DeadLetterStatus.RETRYING, DeadLetterStatus.FAILED, expectedRetryCount, message);

            if (updated > 0) {
                log.error("[DLQ] 재시도 소진. 운영자 확인 필요. dlqId: {}, retryCount: {}, error: {}",
                        id, nextRetryCount, message);
            } else {
                log.info("[DLQ] 재전송 실패 반영 생략 (상태 변경됨). dlqId: {}", id);
            }
            return;
        }

        LocalDateTime nextRetryAt = LocalDateTime.now()
                .plus(Duration.ofMillis(policy.backoffMillis(nextRetryCount)));

        int updated = deadLetterEntryRepository.rearmForRetry(
                id, DeadLetterStatus.RETRYING, DeadLetterStatus.PENDING,
                expectedRetryCount, nextRetryAt, message);

        if (updated > 0) {
            log.warn("[DLQ] 재전송 실패. 재시도 예약. dlqId: {}, retryCount: {}, nextRetryAt: {}, error: {}",
                    id, nextRetryCount, nextRetryAt, message);
        } else {
            log.info("[DLQ] 재전송 실패 반영 생략 (상태 변경됨). dlqId: {}", id);
        }
    }

    /**
     * 선점했지만 재전송을 시작하지 못한 항목을 다시 PENDING 으로
     * 시도 횟수는 증가하지 않음
     */
    public void releaseClaim(String id) {
        int updated = deadLetterEntryRepository.releaseClaim(
                id, DeadLetterStatus.RETRYING, DeadLetterStatus.PENDING, LocalDateTime.now());

        if (updated > 0) {
            log.warn("[DLQ] 재전송 시작 불가. 선점 해제. dlqId: {}", id);
        }
    }
}
