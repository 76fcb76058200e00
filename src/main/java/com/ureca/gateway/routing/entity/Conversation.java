package com.ureca.gateway.routing.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 대화 정보 (라우팅 조회 전용)
 * 대화 생성/수정은 다른 서비스 책임이라 여기서는 읽기만 함
 */
@Entity
@Table(name = "conversations")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Conversation {

    @Id
    @Column(name = "conversation_id", length = 64)
    private String id;

    // 배정된 에이전트가 없으면 null
    @Column(length = 64)
    private String agentId;

    @Column(length = 64)
    private String userId;

    private LocalDateTime createdAt;

    @Builder
    private Conversation(String id, String agentId, String userId, LocalDateTime createdAt) {
        this.id = id;
        this.agentId = agentId;
        this.userId = userId;
        this.createdAt = createdAt;
    }
}
