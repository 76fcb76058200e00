package com.ureca.gateway.routing.repository;

import com.ureca.gateway.routing.entity.Conversation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface ConversationRepository extends JpaRepository<Conversation, String> {

    /**
     * 대화에 배정된 에이전트 ID 조회
     * 대화가 없거나 배정되지 않았으면 empty
     */
    @Query("SELECT c.agentId FROM Conversation c WHERE c.id = :conversationId AND c.agentId IS NOT NULL")
    Optional<String> findAgentIdById(@Param("conversationId") String conversationId);
}
