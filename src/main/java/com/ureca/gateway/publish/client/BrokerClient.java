package com.ureca.gateway.publish.client;

import com.ureca.gateway.config.GatewayProperties;
import com.ureca.gateway.publish.dto.OutboundEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/**
 * 이벤트 브로커 HTTP 통신 전담
 * 한 번의 POST 만 수행하고 재시도는 호출자 책임
 */
@Slf4j
@Component
public class BrokerClient {

    public static final MediaType CLOUDEVENTS_JSON = MediaType.parseMediaType("application/cloudevents+json");

    private final RestClient brokerRestClient;
    private final String brokerUrl;

    public BrokerClient(
            @Qualifier("brokerRestClient") RestClient brokerRestClient,
            GatewayProperties properties
    ) {
        this.brokerRestClient = brokerRestClient;
        this.brokerUrl = properties.broker().url();
    }

    /**
     * CloudEvent 발행 (structured mode)
     *
     * @param event 발행할 이벤트
     * @throws com.ureca.gateway.publish.exception.BrokerPublishException 2xx 가 아닌 응답
     * @throws org.springframework.web.client.ResourceAccessException    연결 실패, 타임아웃
     */
    public void send(OutboundEvent event) {
        log.debug("[Broker] 이벤트 발행 요청. eventId: {}, type: {}", event.id(), event.type());

        brokerRestClient.post()
                .uri(brokerUrl)
                .contentType(CLOUDEVENTS_JSON)
                .body(event)
                .retrieve()
                .toBodilessEntity();
    }
}
