package com.ureca.gateway.dlq.notification;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ureca.gateway.dlq.dto.DeadLetterStatistics;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Slack Incoming Webhook 본문 (attachment 형식)
 */
public record SlackAlertPayload(
        String text,
        List<Attachment> attachments
) {
    static final String EXHAUSTED_TITLE = "경고 DLQ 재시도 소진 메시지 감지";

    private static final String FOOTER = "agent-gateway DLQ monitor";
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final String ACTION_GUIDE = """
            1. GET /api/admin/dlq?status=FAILED 로 실패 원인 확인
            2. 브로커 상태 점검 후 재처리 또는 해결 처리
            3. POST /api/admin/dlq/{id}/resolve 로 종료
            """;

    public record Attachment(
            String color,
            List<Field> fields,
            String footer,
            long ts
    ) {
    }

    public record Field(
            String title,
            String value,
            @JsonProperty("short") boolean shortField
    ) {
    }

    /**
     * 재시도 소진(FAILED) 알림
     *
     * @param statistics 감지 시점 DLQ 통계
     * @param detectedAt 감지 시각
     */
    public static SlackAlertPayload exhausted(DeadLetterStatistics statistics, LocalDateTime detectedAt) {
        List<Field> fields = List.of(
                new Field("재시도 소진", statistics.failed() + "건", true),
                new Field("재시도 대기", statistics.pending() + "건", true),
                new Field("재전송 중", statistics.retrying() + "건", true),
                new Field("발생 시각", detectedAt.format(TIMESTAMP), true),
                new Field("조치", ACTION_GUIDE, false)
        );

        long epochSeconds = detectedAt.atZone(ZoneId.systemDefault()).toEpochSecond();

        return new SlackAlertPayload(EXHAUSTED_TITLE,
                List.of(new Attachment("danger", fields, FOOTER, epochSeconds)));
    }
}
