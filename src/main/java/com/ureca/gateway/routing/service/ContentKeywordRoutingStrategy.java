package com.ureca.gateway.routing.service;

import com.ureca.gateway.config.GatewayProperties;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 메시지 본문 키워드 기반 에이전트 선택
 * gateway.routing.keyword-agents 가 비어 있으면 항상 empty (기본값)
 */
@Component
@Order(2)
public class ContentKeywordRoutingStrategy implements RoutingStrategy {

    private final Map<String, String> keywordAgents;

    public ContentKeywordRoutingStrategy(GatewayProperties properties) {
        this.keywordAgents = properties.routing().keywordAgents();
    }

    @Override
    public Optional<String> resolve(RoutingRequest request) {
        if (keywordAgents.isEmpty() || request.content() == null || request.content().isBlank()) {
            return Optional.empty();
        }

        String content = request.content().toLowerCase(Locale.ROOT);
        return keywordAgents.entrySet().stream()
                .filter(entry -> content.contains(entry.getKey().toLowerCase(Locale.ROOT)))
                .map(Map.Entry::getValue)
                .findFirst();
    }
}
