package com.ureca.gateway.common;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum BaseCode {

    // common
    INVALID_INPUT("INVALID_INPUT_400", HttpStatus.BAD_REQUEST, "잘못된 요청입니다."),

    // 인바운드 이벤트 - 예외
    INVALID_EVENT("INVALID_EVENT_400", HttpStatus.BAD_REQUEST, "이벤트 형식이 올바르지 않습니다."),
    DUPLICATE_EVENT("DUPLICATE_EVENT_409", HttpStatus.CONFLICT, "이미 처리된 이벤트입니다."),

    // 인증 (예약, 현재 미사용)
    UNAUTHORIZED("UNAUTHORIZED_401", HttpStatus.UNAUTHORIZED, "인증에 실패했습니다."),

    // DLQ - 성공
    DLQ_LIST_SUCCESS("DLQ_LIST_SUCCESS_200", HttpStatus.OK, "DLQ 목록을 조회했습니다."),
    DLQ_DETAIL_SUCCESS("DLQ_DETAIL_SUCCESS_200", HttpStatus.OK, "DLQ 상세를 조회했습니다."),
    DLQ_STATISTICS_SUCCESS("DLQ_STATISTICS_SUCCESS_200", HttpStatus.OK, "DLQ 통계를 조회했습니다."),
    DLQ_RESOLVE_SUCCESS("DLQ_RESOLVE_SUCCESS_200", HttpStatus.OK, "DLQ 항목이 해결 처리되었습니다."),
    DLQ_RETRY_SUCCESS("DLQ_RETRY_SUCCESS_200", HttpStatus.OK, "재시도 대상 DLQ 항목을 재발행 요청했습니다."),
    DLQ_CLEANUP_SUCCESS("DLQ_CLEANUP_SUCCESS_200", HttpStatus.OK, "만료된 DLQ 항목을 정리했습니다."),

    // DLQ - 예외
    DLQ_ENTRY_NOT_FOUND("DLQ_ENTRY_NOT_FOUND_404", HttpStatus.NOT_FOUND, "DLQ 항목을 찾을 수 없습니다."),
    DLQ_SERIALIZATION_ERROR("DLQ_SERIALIZATION_ERROR_500", HttpStatus.INTERNAL_SERVER_ERROR, "DLQ 항목 직렬화에 실패했습니다."),

    // 브로커 발행
    BROKER_PUBLISH_ERROR("BROKER_PUBLISH_ERROR_500", HttpStatus.INTERNAL_SERVER_ERROR, "브로커 발행에 실패했습니다."),
    BROKER_DELIVERY_EXHAUSTED("BROKER_DELIVERY_EXHAUSTED_500", HttpStatus.INTERNAL_SERVER_ERROR, "브로커 발행 재시도를 모두 소진했습니다."),

    // 데이터 저장소
    DATASTORE_NOT_READY("DATASTORE_NOT_READY_500", HttpStatus.INTERNAL_SERVER_ERROR, "데이터 저장소가 준비되지 않았습니다."),

    // 서버 내부 예외
    INTERNAL_SERVER_ERROR("INTERNAL_SERVER_ERROR_500", HttpStatus.INTERNAL_SERVER_ERROR, "서버 내부 오류가 발생했습니다. 잠시 후 다시 시도해주세요.");
    private final String code;
    private final HttpStatus status;
    private final String message;
}
