package com.ureca.gateway.publish.client;

import com.ureca.gateway.publish.exception.BrokerPublishException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.client.MockClientHttpResponse;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BrokerResponseErrorHandlerTest {

    private final BrokerResponseErrorHandler handler = new BrokerResponseErrorHandler();

    private static final URI BROKER = URI.create("http://broker.test/default/default");

    @ParameterizedTest
    @ValueSource(ints = {200, 201, 202, 204})
    @DisplayName("2xx : 에러 아님")
    void hasError_2xx_False(int status) throws IOException {
        assertThat(handler.hasError(new MockClientHttpResponse(new byte[0], HttpStatus.valueOf(status)))).isFalse();
    }

    @ParameterizedTest
    @ValueSource(ints = {301, 400, 404, 429, 500, 503})
    @DisplayName("2xx 외 : 모두 에러")
    void hasError_Non2xx_True(int status) throws IOException {
        assertThat(handler.hasError(new MockClientHttpResponse(new byte[0], HttpStatus.valueOf(status)))).isTrue();
    }

    @Test
    @DisplayName("긴 응답 본문은 500자로 자름")
    void handleError_TruncatesBody() {
        String longBody = "x".repeat(2000);
        MockClientHttpResponse response = new MockClientHttpResponse(
                longBody.getBytes(StandardCharsets.UTF_8), HttpStatus.BAD_GATEWAY);

        assertThatThrownBy(() -> handler.handleError(BROKER, HttpMethod.POST, response))
                .isInstanceOf(BrokerPublishException.class)
                .hasMessage("Broker returned status 502: " + "x".repeat(500));
    }
}
