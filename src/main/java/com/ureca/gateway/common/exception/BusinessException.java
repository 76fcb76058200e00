package com.ureca.gateway.common.exception;

import com.ureca.gateway.common.BaseCode;

/**
 * 클라이언트 책임의 예외 (4xx)
 * 상태 코드는 BaseCode 가 결정
 */
public abstract class BusinessException extends BaseCustomException {

    protected BusinessException(BaseCode baseCode) {
        super(baseCode);
    }

    protected BusinessException(BaseCode baseCode, String customMessage) {
        super(baseCode, customMessage);
    }
}
