package com.ureca.gateway.routing.service;

import java.util.Optional;

/**
 * 에이전트 선택 전략
 * 결정할 수 없으면 empty 를 반환해서 다음 전략으로 넘김
 * 순서는 @Order 로 지정
 */
public interface RoutingStrategy {

    Optional<String> resolve(RoutingRequest request);
}
