package com.ureca.gateway.ingest.dto;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpHeaders;

/**
 * 인바운드 CloudEvent
 * <p>
 * structured mode : 본문이 CloudEvent 전체 (application/cloudevents+json)
 * binary mode : 속성은 ce-* 헤더, 본문이 data
 */
public record InboundEventRequest(
        String id,
        String source,
        String type,
        String specversion,
        String datacontenttype,
        String time,
        JsonNode data
) {
    static final String HEADER_PREFIX = "ce-";

    public static InboundEventRequest from(HttpHeaders headers, JsonNode body) {
        if (headers.containsKey(HEADER_PREFIX + "type")) {
            return new InboundEventRequest(
                    headers.getFirst(HEADER_PREFIX + "id"),
                    headers.getFirst(HEADER_PREFIX + "source"),
                    headers.getFirst(HEADER_PREFIX + "type"),
                    headers.getFirst(HEADER_PREFIX + "specversion"),
                    headers.getFirst(HttpHeaders.CONTENT_TYPE),
                    headers.getFirst(HEADER_PREFIX + "time"),
                    body
            );
        }
        return structured(body);
    }

    public static InboundEventRequest structured(JsonNode body) {
        return new InboundEventRequest(
                text(body, "id"),
                text(body, "source"),
                text(body, "type"),
                text(body, "specversion"),
                text(body, "datacontenttype"),
                text(body, "time"),
                body == null ? null : body.get("data")
        );
    }

    private static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
