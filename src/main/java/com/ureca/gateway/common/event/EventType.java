package com.ureca.gateway.common.event;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 게이트웨이가 다루는 CloudEvent type
 * 인바운드는 MESSAGE_RECEIVED 하나만 처리하고 나머지는 무시
 */
@Getter
@RequiredArgsConstructor
public enum EventType {
    MESSAGE_RECEIVED("messaging.message.received"),
    AGENT_MESSAGE("agent.message");

    private final String typeName;      // "messaging.message.received"

    /**
     * 타입 이름 → Enum 매핑 (O(1) 조회)
     */
    private static final Map<String, EventType> TYPE_MAP;

    static {
        TYPE_MAP = new HashMap<>();
        for (EventType type : values()) {
            TYPE_MAP.put(type.typeName, type);
        }
    }

    /**
     * 타입 이름으로 EventType 조회
     * 알 수 없는 타입은 예외 대신 빈 값 (인입 경로에서 무시 처리)
     *
     * @param typeName CloudEvent type (예: "messaging.message.received")
     * @return EventType, 없으면 Optional.empty()
     */
    public static Optional<EventType> find(String typeName) {
        if (typeName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(TYPE_MAP.get(typeName));
    }
}
