package com.ureca.gateway.dlq.notification;

import com.ureca.gateway.config.AsyncConfig;
import com.ureca.gateway.dlq.dto.DeadLetterStatistics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.LocalDateTime;

/**
 * DLQ 재시도 소진 알림 (Slack Webhook)
 * <p>
 * 모니터 스레드를 막지 않도록 알림 Executor 에서 전송
 * Webhook 호출 실패는 1초 간격 최대 3회 재시도, 그래도 실패하면 로그만 남김
 */
@Slf4j
@Component
public class DeadLetterAlertNotifier {

    private final RestClient webhookClient;

    public DeadLetterAlertNotifier(
            RestClient.Builder restClientBuilder,
            @Value("${slack.webhook.url}") String webhookUrl
    ) {
        this.webhookClient = restClientBuilder
                .baseUrl(webhookUrl)
                .build();
    }

    @Async(AsyncConfig.NOTIFICATION_EXECUTOR_NAME)
    @Retryable(
            retryFor = RestClientException.class,
            maxAttempts = 3,
            backoff = @Backoff(delay = 1000)
    )
    public void notifyExhausted(DeadLetterStatistics statistics) {
        webhookClient.post()
                .contentType(MediaType.APPLICATION_JSON)
                .body(SlackAlertPayload.exhausted(statistics, LocalDateTime.now()))
                .retrieve()
                .toBodilessEntity();

        log.info("[DLQ 알림] 전송 완료. failed: {}", statistics.failed());
    }

    // 알림 실패가 전달 파이프라인에 영향 주지 않도록 로그만
    @Recover
    public void recover(RestClientException e, DeadLetterStatistics statistics) {
        log.error("[DLQ 알림] 3회 재시도 후 전송 포기. failed: {}, pending: {}, error: {}",
                statistics.failed(), statistics.pending(), e.getMessage());
    }
}
