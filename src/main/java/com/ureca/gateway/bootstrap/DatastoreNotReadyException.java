package com.ureca.gateway.bootstrap;

import com.ureca.gateway.common.exception.InternalServerException;

import static com.ureca.gateway.common.BaseCode.DATASTORE_NOT_READY;

public class DatastoreNotReadyException extends InternalServerException {

    public DatastoreNotReadyException(int attempts, Throwable cause) {
        super(DATASTORE_NOT_READY, "데이터 저장소 초기화 실패. attempts: " + attempts, cause);
    }
}
