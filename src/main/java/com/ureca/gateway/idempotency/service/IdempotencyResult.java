package com.ureca.gateway.idempotency.service;

public enum IdempotencyResult {
    FRESH, // 처음 보는 키 (처리 진행)
    DUPLICATE // 이미 처리된 키 (성공 응답 후 중단)
}
