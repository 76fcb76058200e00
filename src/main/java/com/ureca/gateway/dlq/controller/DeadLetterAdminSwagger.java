package com.ureca.gateway.dlq.controller;

import com.ureca.gateway.common.ApiResponse;
import com.ureca.gateway.dlq.dto.DeadLetterEntryResponse;
import com.ureca.gateway.dlq.dto.DeadLetterStatistics;
import com.ureca.gateway.dlq.dto.ResolveRequest;
import com.ureca.gateway.dlq.entity.DeadLetterStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Tag(name = "DLQ 관리", description = "전달 실패 메시지 조회 및 운영자 처리 API")
@RequestMapping("/api/admin/dlq")
public interface DeadLetterAdminSwagger {

    @Operation(summary = "상태별 DLQ 목록", description = "상태별 DLQ 항목을 최신순으로 조회합니다.")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "조회 성공"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "잘못된 상태 값")
    })
    @GetMapping
    ResponseEntity<ApiResponse<List<DeadLetterEntryResponse>>> getEntries(
            @Parameter(description = "조회할 상태") @RequestParam(defaultValue = "FAILED") DeadLetterStatus status,
            @Parameter(description = "최대 건수") @RequestParam(defaultValue = "50") @Min(1) @Max(1000) int limit
    );

    @Operation(summary = "DLQ 통계", description = "전체 및 상태별 항목 수를 조회합니다.")
    @GetMapping("/statistics")
    ResponseEntity<ApiResponse<DeadLetterStatistics>> getStatistics();

    @Operation(summary = "DLQ 상세", description = "재전송 payload 를 포함한 항목 상세를 조회합니다.")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "조회 성공"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "존재하지 않는 항목")
    })
    @GetMapping("/{id}")
    ResponseEntity<ApiResponse<DeadLetterEntryResponse>> getEntry(@PathVariable String id);

    @Operation(summary = "해결 처리", description = "항목을 RESOLVED 로 변경합니다. 이미 해결된 항목은 사유를 덮어씁니다.")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "해결 처리 성공"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "존재하지 않는 항목")
    })
    @PostMapping("/{id}/resolve")
    ResponseEntity<ApiResponse<Void>> resolve(
            @PathVariable String id,
            @Valid @RequestBody(required = false) ResolveRequest request
    );

    @Operation(summary = "수동 재시도 스윕", description = "재시도 시각이 도래한 항목을 즉시 선점하고 재전송합니다.")
    @PostMapping("/retry")
    ResponseEntity<ApiResponse<Integer>> retryPending();

    @Operation(summary = "수동 만료 정리", description = "보관 기간이 지난 항목을 즉시 삭제합니다.")
    @PostMapping("/cleanup")
    ResponseEntity<ApiResponse<Integer>> cleanupExpired();
}
