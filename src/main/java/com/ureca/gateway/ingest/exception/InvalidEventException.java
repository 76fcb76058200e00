package com.ureca.gateway.ingest.exception;

import com.ureca.gateway.common.exception.BusinessException;

import static com.ureca.gateway.common.BaseCode.INVALID_EVENT;

public class InvalidEventException extends BusinessException {

    public InvalidEventException(String message) {
        super(INVALID_EVENT, message);
    }
}
