package com.ureca.gateway.publish.exception;

import com.ureca.gateway.common.exception.InternalServerException;

import static com.ureca.gateway.common.BaseCode.BROKER_DELIVERY_EXHAUSTED;

/**
 * 재시도를 모두 소진해서 전달 실패 (DLQ 로 넘어간 뒤 발생)
 */
public class DeliveryFailedException extends InternalServerException {

    public DeliveryFailedException(String eventId, int attempts, Throwable cause) {
        super(BROKER_DELIVERY_EXHAUSTED,
                "브로커 발행 재시도 소진. eventId: " + eventId + ", attempts: " + attempts, cause);
    }
}
