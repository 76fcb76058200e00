package com.ureca.gateway.routing.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * 메시지를 처리할 에이전트 결정
 * <p>
 * 등록된 전략을 순서대로 시도하고 처음 결정된 값을 사용
 * 전략이 예외를 던지면 로그만 남기고 다음 전략으로 (라우팅은 실패하지 않음)
 */
@Slf4j
@Service
public class RoutingResolver {

    private final List<RoutingStrategy> strategies;
    private final StaticDefaultRoutingStrategy defaultStrategy;

    // List 주입은 @Order 순서로 정렬됨
    public RoutingResolver(List<RoutingStrategy> strategies, StaticDefaultRoutingStrategy defaultStrategy) {
        this.strategies = strategies;
        this.defaultStrategy = defaultStrategy;
    }

    public String resolve(RoutingRequest request) {
        for (RoutingStrategy strategy : strategies) {
            try {
                Optional<String> agentId = strategy.resolve(request);
                if (agentId.isPresent()) {
                    log.debug("[Routing] 에이전트 결정. conversationId: {}, agentId: {}, strategy: {}",
                            request.conversationId(), agentId.get(), strategy.getClass().getSimpleName());
                    return agentId.get();
                }
            } catch (Exception e) {
                log.warn("[Routing] 전략 실행 실패, 다음 전략으로 진행. conversationId: {}, strategy: {}, error: {}",
                        request.conversationId(), strategy.getClass().getSimpleName(), e.getMessage());
            }
        }
        return defaultStrategy.defaultAgentId();
    }
}
