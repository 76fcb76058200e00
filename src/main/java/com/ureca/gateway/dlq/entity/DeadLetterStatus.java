package com.ureca.gateway.dlq.entity;

public enum DeadLetterStatus {
    PENDING, // 재시도 대기 (next_retry_at 도래 시 스윕 대상)
    RETRYING, // 스윕이 선점해서 재전송 진행 중
    FAILED, // 재시도 소진 (운영자 개입 필요)
    RESOLVED // 운영자 해결 또는 재전송 성공
}
