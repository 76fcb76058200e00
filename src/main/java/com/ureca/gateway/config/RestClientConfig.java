package com.ureca.gateway.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Scope;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * 게이트웨이 외부 호출 공통 RestClient 설정
 * 브로커는 BrokerRestClientConfig 에서 자체 타임아웃으로 덮어씀
 * 나머지(슬랙 알림 등)는 여기 기본값 사용
 */
@Configuration
public class RestClientConfig {

    static final String USER_AGENT = "agent-gateway";

    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(3);
    private static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(10);

    @Bean
    public ClientHttpRequestFactory defaultRequestFactory() {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(DEFAULT_CONNECT_TIMEOUT);
        factory.setReadTimeout(DEFAULT_READ_TIMEOUT);
        return factory;
    }

    /**
     * 호출 대상마다 인터셉터/에러 핸들러가 달라 빌더 상태가 섞이지 않도록 Prototype
     *
     * @param defaultRequestFactory 기본 타임아웃 팩토리
     * @return User-Agent 가 지정된 RestClient.Builder
     */
    @Bean
    @Scope("prototype")
    public RestClient.Builder restClientBuilder(ClientHttpRequestFactory defaultRequestFactory) {
        return RestClient.builder()
                .requestFactory(defaultRequestFactory)
                .defaultHeader(HttpHeaders.USER_AGENT, USER_AGENT);
    }
}
