package com.ureca.gateway.dlq.controller;

import com.ureca.gateway.common.ApiResponse;
import com.ureca.gateway.dlq.dto.DeadLetterEntryResponse;
import com.ureca.gateway.dlq.dto.DeadLetterStatistics;
import com.ureca.gateway.dlq.dto.ResolveRequest;
import com.ureca.gateway.dlq.entity.DeadLetterStatus;
import com.ureca.gateway.dlq.service.DeadLetterQueue;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

import static com.ureca.gateway.common.BaseCode.*;

@Slf4j
@Validated
@RestController
@RequiredArgsConstructor
public class DeadLetterAdminController implements DeadLetterAdminSwagger {

    private final DeadLetterQueue deadLetterQueue;

    @Override
    public ResponseEntity<ApiResponse<List<DeadLetterEntryResponse>>> getEntries(
            @RequestParam(defaultValue = "FAILED") DeadLetterStatus status,
            @RequestParam(defaultValue = "50") @Min(1) @Max(1000) int limit) {

        List<DeadLetterEntryResponse> entries = deadLetterQueue.getEntriesByStatus(status, limit).stream()
                .map(DeadLetterEntryResponse::summary)
                .toList();

        return ResponseEntity.ok(ApiResponse.of(DLQ_LIST_SUCCESS, entries));
    }

    @Override
    public ResponseEntity<ApiResponse<DeadLetterStatistics>> getStatistics() {
        return ResponseEntity.ok(ApiResponse.of(DLQ_STATISTICS_SUCCESS, deadLetterQueue.getStatistics()));
    }

    @Override
    public ResponseEntity<ApiResponse<DeadLetterEntryResponse>> getEntry(@PathVariable String id) {
        DeadLetterEntryResponse response = DeadLetterEntryResponse.detail(deadLetterQueue.findById(id));
        return ResponseEntity.ok(ApiResponse.of(DLQ_DETAIL_SUCCESS, response));
    }

    @Override
    public ResponseEntity<ApiResponse<Void>> resolve(
            @PathVariable String id,
            @Valid @RequestBody(required = false) ResolveRequest request) {

        String reason = request == null ? null : request.reason();
        log.info("[DLQ 관리] 해결 처리 요청. dlqId: {}, reason: {}", id, reason);

        deadLetterQueue.markResolved(id, reason);

        return ResponseEntity.ok(ApiResponse.ok(DLQ_RESOLVE_SUCCESS));
    }

    @Override
    public ResponseEntity<ApiResponse<Integer>> retryPending() {
        log.info("[DLQ 관리] 수동 재시도 스윕 요청");
        return ResponseEntity.ok(ApiResponse.of(DLQ_RETRY_SUCCESS, deadLetterQueue.retryPendingMessages()));
    }

    @Override
    public ResponseEntity<ApiResponse<Integer>> cleanupExpired() {
        log.info("[DLQ 관리] 수동 만료 정리 요청");
        return ResponseEntity.ok(ApiResponse.of(DLQ_CLEANUP_SUCCESS, deadLetterQueue.cleanupExpired()));
    }
}
