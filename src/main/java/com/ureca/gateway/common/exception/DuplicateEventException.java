package com.ureca.gateway.common.exception;

import static com.ureca.gateway.common.BaseCode.DUPLICATE_EVENT;

/**
 * 중복 키 충돌 (409)
 * 인입 경로에서는 중복을 성공으로 처리하므로 현재 던지지 않음
 */
public class DuplicateEventException extends BusinessException {

    public DuplicateEventException(String idempotencyKey) {
        super(DUPLICATE_EVENT, "이미 처리된 이벤트입니다. idempotencyKey: " + idempotencyKey);
    }
}
