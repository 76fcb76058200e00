package com.ureca.gateway.dlq.entity;

public enum DeadLetterErrorType {
    BROKER_PUBLISH_FAILED,
    STORAGE_FAILED,
    VALIDATION_FAILED,
    TIMEOUT,
    SERVICE_UNAVAILABLE,
    NETWORK_ERROR,
    UNKNOWN
}
