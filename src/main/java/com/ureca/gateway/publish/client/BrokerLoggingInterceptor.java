package com.ureca.gateway.publish.client;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;

import java.io.IOException;

/**
 * 브로커 호출 로깅 인터셉터
 * 본문은 메시지 내용이라 남기지 않고 상태와 소요시간만 기록
 */
@Slf4j
public class BrokerLoggingInterceptor implements ClientHttpRequestInterceptor {

    @Override
    @NonNull
    public ClientHttpResponse intercept(
            @NonNull HttpRequest request,
            @NonNull byte[] body,
            @NonNull ClientHttpRequestExecution execution) throws IOException {

        long startTime = System.currentTimeMillis();

        try {
            ClientHttpResponse response = execution.execute(request, body);
            long duration = System.currentTimeMillis() - startTime;

            log.debug("[Broker] {} {} | status={} | duration={}ms | size={}B",
                    request.getMethod(), request.getURI(), response.getStatusCode().value(), duration, body.length);

            return response;
        } catch (IOException e) {
            long duration = System.currentTimeMillis() - startTime;
            log.warn("[Broker] {} {} | ERROR | duration={}ms | exception={}",
                    request.getMethod(), request.getURI(), duration, e.getMessage());
            throw e;
        }
    }
}
