package com.ureca.gateway.config;

import com.ureca.gateway.publish.client.BrokerLoggingInterceptor;
import com.ureca.gateway.publish.client.BrokerResponseErrorHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * 이벤트 브로커 전용 RestClient 설정
 * 로깅 인터셉터 및 에러 핸들러 포함
 */
@Configuration
@RequiredArgsConstructor
public class BrokerRestClientConfig {

    private final GatewayProperties gatewayProperties;
    private final RestClient.Builder restClientBuilder;  // 공통 빌더 주입

    @Bean
    public BrokerResponseErrorHandler brokerResponseErrorHandler() {
        return new BrokerResponseErrorHandler();
    }

    @Bean
    public BrokerLoggingInterceptor brokerLoggingInterceptor() {
        return new BrokerLoggingInterceptor();
    }

    @Bean
    public RestClient brokerRestClient(BrokerResponseErrorHandler errorHandler,
                                       BrokerLoggingInterceptor loggingInterceptor) {
        GatewayProperties.Broker broker = gatewayProperties.broker();

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(broker.connectTimeout());
        requestFactory.setReadTimeout(broker.readTimeout());

        return restClientBuilder
                .requestFactory(requestFactory)
                .requestInterceptor(loggingInterceptor)
                .defaultStatusHandler(errorHandler)
                .build();
    }
}
