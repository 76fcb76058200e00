package com.ureca.gateway.ingest.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.ureca.gateway.ingest.dto.InboundEventRequest;
import com.ureca.gateway.ingest.service.IngestOutcome;
import com.ureca.gateway.ingest.service.MessageIngestionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequiredArgsConstructor
public class GatewayController implements GatewaySwagger {

    static final String ACK = "OK";

    private final MessageIngestionService messageIngestionService;

    @Override
    public ResponseEntity<String> receive(@RequestHeader HttpHeaders headers, @RequestBody JsonNode body) {
        InboundEventRequest request = InboundEventRequest.from(headers, body);

        IngestOutcome outcome = messageIngestionService.ingest(request);
        log.debug("[Ingest] 이벤트 처리 결과. id: {}, outcome: {}", request.id(), outcome);

        return ack();
    }

    @Override
    public ResponseEntity<String> health() {
        return ack();
    }

    @Override
    public ResponseEntity<String> ready() {
        return ack();
    }

    private ResponseEntity<String> ack() {
        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_PLAIN)
                .body(ACK);
    }
}
