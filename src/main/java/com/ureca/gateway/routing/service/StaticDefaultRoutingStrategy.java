package com.ureca.gateway.routing.service;

import com.ureca.gateway.config.GatewayProperties;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 마지막 전략 - 항상 기본 에이전트 반환
 */
@Component
@Order(Ordered.LOWEST_PRECEDENCE)
public class StaticDefaultRoutingStrategy implements RoutingStrategy {

    private final String defaultAgentId;

    public StaticDefaultRoutingStrategy(GatewayProperties properties) {
        this.defaultAgentId = properties.routing().defaultAgentId();
    }

    @Override
    public Optional<String> resolve(RoutingRequest request) {
        return Optional.of(defaultAgentId);
    }

    public String defaultAgentId() {
        return defaultAgentId;
    }
}
