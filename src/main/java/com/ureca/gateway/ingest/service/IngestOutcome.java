package com.ureca.gateway.ingest.service;

public enum IngestOutcome {
    ACCEPTED, // 발행 예약 완료
    DUPLICATE, // 이미 처리된 멱등 키
    IGNORED // 처리 대상이 아닌 이벤트 타입
}
