package com.ureca.gateway.idempotency.service;

/**
 * 인바운드 이벤트 중복 처리 방지 (2차 방어선)
 * <p>
 * 1차 멱등성은 상위 계층에서 보장한다고 가정하고
 * 이 컴포넌트 안에서의 재처리만 막는다
 * 구현체마다 동시 중복 전달에 대한 보장 수준이 다름
 */
public interface IdempotencyGuard {

    /**
     * 멱등 키 확인
     *
     * @param key 멱등 키
     * @return FRESH 면 처리 진행, DUPLICATE 면 중단
     */
    IdempotencyResult checkAndMark(String key);

    /**
     * 처리 완료 기록 (이벤트 영속화 경로)
     * checkAndMark 가 이미 기록하는 전략에서는 아무것도 하지 않음
     *
     * @param key       멱등 키
     * @param messageId 메시지 ID (없으면 null)
     */
    void recordProcessed(String key, String messageId);
}
