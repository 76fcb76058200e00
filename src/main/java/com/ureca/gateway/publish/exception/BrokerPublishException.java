package com.ureca.gateway.publish.exception;

import com.ureca.gateway.common.exception.InternalServerException;
import lombok.Getter;

import static com.ureca.gateway.common.BaseCode.BROKER_PUBLISH_ERROR;

/**
 * 브로커가 2xx 가 아닌 응답을 반환 (한 번의 시도 실패)
 * 재시도 대상
 */
@Getter
public class BrokerPublishException extends InternalServerException {

    private final int statusCode;

    public BrokerPublishException(int statusCode, String message) {
        super(BROKER_PUBLISH_ERROR, message);
        this.statusCode = statusCode;
    }
}
