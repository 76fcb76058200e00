package com.ureca.gateway.publish.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.ureca.gateway.common.event.EventType;

import java.time.Instant;
import java.util.UUID;

/**
 * 브로커로 발행하는 CloudEvent (structured mode, 1.0)
 * <p>
 * data 는 인바운드 이벤트의 data 를 그대로 전달
 * agentid 는 브로커 트리거 필터용 확장 속성 (라우팅 결과)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OutboundEvent(
        String id,
        String source,
        String type,
        String specversion,
        String datacontenttype,
        String time,
        String agentid,
        JsonNode data
) {
    public static final String SPEC_VERSION = "1.0";
    public static final String DATA_CONTENT_TYPE = "application/json";

    public static OutboundEvent agentMessage(String source, String agentId, JsonNode data) {
        return new OutboundEvent(
                UUID.randomUUID().toString(),
                source,
                EventType.AGENT_MESSAGE.getTypeName(),
                SPEC_VERSION,
                DATA_CONTENT_TYPE,
                Instant.now().toString(),
                agentId,
                data
        );
    }

    // 재전송은 새 이벤트 ID 로 (브로커 입장에서는 새 이벤트)
    public OutboundEvent withNewId() {
        return new OutboundEvent(
                UUID.randomUUID().toString(),
                source,
                type,
                specversion,
                datacontenttype,
                Instant.now().toString(),
                agentid,
                data
        );
    }
}
