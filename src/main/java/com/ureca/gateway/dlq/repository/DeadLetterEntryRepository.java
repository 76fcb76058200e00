package com.ureca.gateway.dlq.repository;

import com.ureca.gateway.dlq.entity.DeadLetterEntry;
import com.ureca.gateway.dlq.entity.DeadLetterStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

public interface DeadLetterEntryRepository extends JpaRepository<DeadLetterEntry, String> {

    /**
     * 재시도 시각이 도래한 PENDING 항목 ID 조회 (배치 크기 제한)
     * idx_dlq_status_next_retry 인덱스 활용
     *
     * @param status   PENDING
     * @param now      기준 시각
     * @param pageable 배치 크기 (Limit)
     * @return 오래된 next_retry_at 순서의 ID 목록
     */
    @Query("SELECT d.id FROM DeadLetterEntry d " +
            "WHERE d.status = :status " +
            "AND d.nextRetryAt <= :now " +
            "AND d.retryCount < d.maxRetries " +
            "ORDER BY d.nextRetryAt ASC")
    List<String> findDueIds(
            @Param("status") DeadLetterStatus status,
            @Param("now") LocalDateTime now,
            Pageable pageable
    );

    /**
     * 상태별 최신순 조회 (limit 은 Pageable 로)
     */
    List<DeadLetterEntry> findByStatusOrderByCreatedAtDesc(DeadLetterStatus status, Pageable pageable);

    long countByStatus(DeadLetterStatus status);

    /**
     * 재시도 대상 선점 PENDING 에서 RETRYING 으로 원자적 업데이트
     * 조건을 조회 시점과 동일하게 다시 걸어서 여러 스윕이 동시에 돌아도 한 곳만 선점
     *
     * @param id       DLQ ID
     * @param pending  PENDING
     * @param retrying RETRYING
     * @param now      선점 시각
     * @return 업데이트된 행 수 (0 또는 1)
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE DeadLetterEntry d " +
            "SET d.status = :retrying, d.lastRetryAt = :now, d.nextRetryAt = null " +
            "WHERE d.id = :id " +
            "AND d.status = :pending " +
            "AND d.nextRetryAt <= :now " +
            "AND d.retryCount < d.maxRetries")
    int claimForRetry(
            @Param("id") String id,
            @Param("pending") DeadLetterStatus pending,
            @Param("retrying") DeadLetterStatus retrying,
            @Param("now") LocalDateTime now
    );

    /**
     * 해결 처리 (어떤 상태에서든 허용, RESOLVED 재지정 시 사유/시각 덮어씀)
     *
     * @return 업데이트된 행 수 (0 이면 존재하지 않는 ID)
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE DeadLetterEntry d " +
            "SET d.status = :resolved, d.resolvedAt = :now, d.resolvedReason = :reason, d.nextRetryAt = null " +
            "WHERE d.id = :id")
    int markResolved(
            @Param("id") String id,
            @Param("resolved") DeadLetterStatus resolved,
            @Param("reason") String reason,
            @Param("now") LocalDateTime now
    );

    /**
     * 재전송 성공 RETRYING 에서 RESOLVED
     * 그 사이 운영자가 해결 처리했으면 0
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE DeadLetterEntry d " +
            "SET d.status = :resolved, d.resolvedAt = :now, d.resolvedReason = :reason " +
            "WHERE d.id = :id AND d.status = :retrying")
    int markRedelivered(
            @Param("id") String id,
            @Param("retrying") DeadLetterStatus retrying,
            @Param("resolved") DeadLetterStatus resolved,
            @Param("reason") String reason,
            @Param("now") LocalDateTime now
    );

    /**
     * 재전송 실패 후 재시도 여지가 있을 때 RETRYING 에서 PENDING
     * retryCount 를 조건으로 걸어 같은 실패가 두 번 반영되지 않게 함
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE DeadLetterEntry d " +
            "SET d.status = :pending, d.retryCount = d.retryCount + 1, " +
            "d.nextRetryAt = :nextRetryAt, d.error = :error " +
            "WHERE d.id = :id AND d.status = :retrying AND d.retryCount = :expectedRetryCount")
    int rearmForRetry(
            @Param("id") String id,
            @Param("retrying") DeadLetterStatus retrying,
            @Param("pending") DeadLetterStatus pending,
            @Param("expectedRetryCount") int expectedRetryCount,
            @Param("nextRetryAt") LocalDateTime nextRetryAt,
            @Param("error") String error
    );

    /**
     * 재전송 실패로 재시도 소진 RETRYING 에서 FAILED
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE DeadLetterEntry d " +
            "SET d.status = :failed, d.retryCount = d.retryCount + 1, " +
            "d.nextRetryAt = null, d.error = :error " +
            "WHERE d.id = :id AND d.status = :retrying AND d.retryCount = :expectedRetryCount")
    int markRedeliveryExhausted(
            @Param("id") String id,
            @Param("retrying") DeadLetterStatus retrying,
            @Param("failed") DeadLetterStatus failed,
            @Param("expectedRetryCount") int expectedRetryCount,
            @Param("error") String error
    );

    /**
     * 선점은 했지만 재전송 작업을 시작하지 못한 경우 (발행 풀 포화)
     * 시도 횟수는 그대로 두고 RETRYING 에서 PENDING 으로 되돌림
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE DeadLetterEntry d " +
            "SET d.status = :pending, d.nextRetryAt = :now " +
            "WHERE d.id = :id AND d.status = :retrying")
    int releaseClaim(
            @Param("id") String id,
            @Param("retrying") DeadLetterStatus retrying,
            @Param("pending") DeadLetterStatus pending,
            @Param("now") LocalDateTime now
    );

    /**
     * 만료된 항목 일괄 삭제 (상태 무관)
     * <p>
     * idx_dlq_expires_at 인덱스 활용
     * 각 호출이 독립 트랜잭션으로 처리됨
     *
     * @param now   기준 시각
     * @param limit 한 번에 삭제할 최대 건수
     * @return 삭제된 행 수
     */
    @Transactional
    @Modifying
    @Query(value = "DELETE FROM dead_letter_queue " +
            "WHERE expires_at <= :now " +
            "LIMIT :limit",
            nativeQuery = true)
    int deleteExpired(
            @Param("now") LocalDateTime now,
            @Param("limit") int limit
    );
}
