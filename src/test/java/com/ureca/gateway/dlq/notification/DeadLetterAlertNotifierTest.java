package com.ureca.gateway.dlq.notification;

import com.ureca.gateway.dlq.dto.DeadLetterStatistics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.client.RestClientTest;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClientException;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

/**
 * - Webhook URL 로 POST
 * - DLQ 통계가 attachment 필드로 직렬화
 * - 500 에러 시 예외 전파 (재시도는 프록시 책임이라 여기선 한 번)
 */
@RestClientTest(DeadLetterAlertNotifier.class)
@TestPropertySource(properties =
        "slack.webhook.url=https://hooks.slack.com/services/gateway-test")
class DeadLetterAlertNotifierTest {

    @Autowired
    private DeadLetterAlertNotifier alertNotifier;

    @Autowired
    private MockRestServiceServer mockServer;

    private final DeadLetterStatistics statistics = new DeadLetterStatistics(9, 1, 3, 2, 3);

    @Test
    @DisplayName("성공 : 재시도 소진 알림 전송, 통계가 필드로 들어감")
    void notifyExhausted_Success() {
        // given
        mockServer.expect(requestTo(containsString("hooks.slack.com")))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentType(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.text").value(SlackAlertPayload.EXHAUSTED_TITLE))
                .andExpect(jsonPath("$.attachments[0].color").value("danger"))
                .andExpect(jsonPath("$.attachments[0].fields[0].title").value("재시도 소진"))
                .andExpect(jsonPath("$.attachments[0].fields[0].value").value("3건"))
                .andExpect(jsonPath("$.attachments[0].fields[0].short").value(true))
                .andExpect(jsonPath("$.attachments[0].fields[1].value").value("1건"))
                .andExpect(jsonPath("$.attachments[0].fields[2].value").value("2건"))
                .andExpect(jsonPath("$.attachments[0].fields[4].short").value(false))
                .andRespond(withSuccess());

        // when
        alertNotifier.notifyExhausted(statistics);

        // then
        mockServer.verify();
    }

    @Test
    @DisplayName("예외 : Webhook 500 -> RestClientException 전파")
    void notifyExhausted_ServerError() {
        mockServer.expect(requestTo(containsString("hooks.slack.com")))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withServerError());

        assertThatThrownBy(() -> alertNotifier.notifyExhausted(statistics))
                .isInstanceOf(RestClientException.class);

        mockServer.verify();
    }
}
