package com.ureca.gateway.publish.client;

import com.ureca.gateway.publish.exception.BrokerPublishException;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.ResponseErrorHandler;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;

/**
 * 브로커 응답 에러 처리
 * 2xx 가 아니면 모두 실패 (재시도 여부는 발행자가 결정)
 */
@Slf4j
public class BrokerResponseErrorHandler implements ResponseErrorHandler {

    private static final int MAX_BODY_LENGTH = 500;

    @Override
    public boolean hasError(final ClientHttpResponse response) throws IOException {
        return !response.getStatusCode().is2xxSuccessful();
    }

    @Override
    public void handleError(@NonNull final URI url,
                            @NonNull final HttpMethod method,
                            final ClientHttpResponse response) throws IOException {
        int status = response.getStatusCode().value();
        String responseBody = new String(response.getBody().readAllBytes(), StandardCharsets.UTF_8);

        if (responseBody.length() > MAX_BODY_LENGTH) {
            responseBody = responseBody.substring(0, MAX_BODY_LENGTH);
        }

        log.warn("[Broker] 발행 응답 실패. status: {}, url: {}, responseBody: {}", status, url, responseBody);

        throw new BrokerPublishException(status,
                String.format("Broker returned status %d: %s", status, responseBody));
    }
}
