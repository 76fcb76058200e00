package com.ureca.gateway.common.exception;

import com.ureca.gateway.common.ApiResponse;
import com.ureca.gateway.common.BaseCode;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import static com.ureca.gateway.common.BaseCode.INTERNAL_SERVER_ERROR;
import static com.ureca.gateway.common.BaseCode.INVALID_INPUT;

/**
 * 예외 -> ApiResponse 변환
 * 4xx 는 warn, 5xx 는 error 로 기록
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(BaseCustomException.class)
    public ResponseEntity<ApiResponse<Void>> handleCustomException(BaseCustomException e) {
        BaseCode baseCode = e.getBaseCode();

        if (baseCode.getStatus().is5xxServerError()) {
            log.error("[예외] code: {}, message: {}", baseCode.getCode(), e.getMessage(), e);
        } else {
            log.warn("[예외] code: {}, message: {}", baseCode.getCode(), e.getMessage());
        }

        return ResponseEntity.status(baseCode.getStatus())
                .body(ApiResponse.error(baseCode, e.getMessage()));
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            MethodArgumentNotValidException.class,
            HandlerMethodValidationException.class,
            ConstraintViolationException.class
    })
    public ResponseEntity<ApiResponse<Void>> handleBadRequest(Exception e) {
        log.warn("[예외] 잘못된 요청. error: {}", e.getMessage());

        return ResponseEntity.status(INVALID_INPUT.getStatus())
                .body(ApiResponse.error(INVALID_INPUT, INVALID_INPUT.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleException(Exception e) {
        log.error("[예외] 처리되지 않은 예외", e);

        return ResponseEntity.status(INTERNAL_SERVER_ERROR.getStatus())
                .body(ApiResponse.error(INTERNAL_SERVER_ERROR, INTERNAL_SERVER_ERROR.getMessage()));
    }
}
