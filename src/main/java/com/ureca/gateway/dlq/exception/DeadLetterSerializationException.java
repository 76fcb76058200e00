package com.ureca.gateway.dlq.exception;

import com.ureca.gateway.common.exception.InternalServerException;

import static com.ureca.gateway.common.BaseCode.DLQ_SERIALIZATION_ERROR;

public class DeadLetterSerializationException extends InternalServerException {

    public DeadLetterSerializationException(String message, Throwable cause) {
        super(DLQ_SERIALIZATION_ERROR, message, cause);
    }
}
