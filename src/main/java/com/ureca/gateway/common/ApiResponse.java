package com.ureca.gateway.common;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 공통 응답 포맷
 * 코드, 상태, 메시지 + 선택적 데이터
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(
        String code,
        int status,
        String message,
        T data
) {
    public static <T> ApiResponse<T> of(BaseCode baseCode, T data) {
        return new ApiResponse<>(
                baseCode.getCode(),
                baseCode.getStatus().value(),
                baseCode.getMessage(),
                data
        );
    }

    public static ApiResponse<Void> ok(BaseCode baseCode) {
        return of(baseCode, null);
    }

    public static ApiResponse<Void> error(BaseCode baseCode, String message) {
        return new ApiResponse<>(
                baseCode.getCode(),
                baseCode.getStatus().value(),
                message,
                null
        );
    }
}
