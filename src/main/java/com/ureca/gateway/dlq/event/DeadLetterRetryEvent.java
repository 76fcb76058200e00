package com.ureca.gateway.dlq.event;

/**
 * 스윕이 선점한 DLQ 항목의 재전송 신호
 * 선점(RETRYING 커밋) 이후에만 발행되므로 리스너는 항목 상태를 신뢰할 수 있음
 */
public record DeadLetterRetryEvent(
        String entryId, // DLQ 항목 PK
        int retryCount // 선점 시점의 재시도 횟수 (실패 반영 시 조건으로 사용)
) {
}
