package com.ureca.gateway.routing.service;

import com.ureca.gateway.routing.repository.ConversationRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 기존 대화에 배정된 에이전트를 그대로 사용 (대화 연속성)
 */
@Component
@Order(1)
@RequiredArgsConstructor
public class ConversationHistoryRoutingStrategy implements RoutingStrategy {

    private final ConversationRepository conversationRepository;

    @Override
    public Optional<String> resolve(RoutingRequest request) {
        return conversationRepository.findAgentIdById(request.conversationId())
                .filter(agentId -> !agentId.isBlank());
    }
}
