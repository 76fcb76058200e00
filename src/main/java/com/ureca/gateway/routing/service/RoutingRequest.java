package com.ureca.gateway.routing.service;

/**
 * 라우팅 판단에 필요한 최소 정보
 *
 * @param conversationId 대화 ID
 * @param senderId       발신자 ID
 * @param content        메시지 본문 (내용 기반 라우팅용, 없으면 빈 문자열)
 */
public record RoutingRequest(
        String conversationId,
        String senderId,
        String content
) {
}
