package com.ureca.gateway.ingest.controller;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;

@Tag(name = "이벤트 수신", description = "브로커가 전달하는 CloudEvent 수신 및 상태 확인 API")
public interface GatewaySwagger {

    @Operation(summary = "CloudEvent 수신",
            description = "messaging.message.received 이벤트를 받아 에이전트로 라우팅합니다. " +
                    "중복 이벤트와 처리 대상이 아닌 이벤트도 OK 로 응답합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "접수 (중복/무시 포함)"),
            @ApiResponse(responseCode = "400", description = "data, idempotency_key, conversation_id 누락")
    })
    @PostMapping({"/", "/events"})
    ResponseEntity<String> receive(@RequestHeader HttpHeaders headers, @RequestBody JsonNode body);

    @Operation(summary = "liveness")
    @GetMapping("/health")
    ResponseEntity<String> health();

    @Operation(summary = "readiness")
    @GetMapping("/ready")
    ResponseEntity<String> ready();
}
