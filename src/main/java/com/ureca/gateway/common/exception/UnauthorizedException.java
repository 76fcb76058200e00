package com.ureca.gateway.common.exception;

import static com.ureca.gateway.common.BaseCode.UNAUTHORIZED;

// 인증 실패 (401), 게이트웨이 앞단에서 인증하므로 현재 미사용
public class UnauthorizedException extends BusinessException {

    public UnauthorizedException() {
        super(UNAUTHORIZED);
    }
}
