package com.ureca.gateway.dlq.exception;

import com.ureca.gateway.common.exception.BusinessException;

import static com.ureca.gateway.common.BaseCode.DLQ_ENTRY_NOT_FOUND;

public class DeadLetterEntryNotFoundException extends BusinessException {

    public DeadLetterEntryNotFoundException(String entryId) {
        super(DLQ_ENTRY_NOT_FOUND, "DLQ 항목을 찾을 수 없습니다. id: " + entryId);
    }
}
