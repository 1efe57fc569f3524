package com.monitoring.platform.notification;

import com.monitoring.platform.anomaly.ErrorRateAnomalyRule;
import com.monitoring.platform.config.AlertingProperties;
import com.monitoring.platform.domain.AnomalyEvent;
import com.monitoring.platform.domain.CorrelatedPair;
import com.monitoring.platform.domain.Severity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Builds {@link NotificationPayload}s from anomalies and for operator test alerts.
 * Anomaly titles carry only the severity, so the dispatcher's rate limit lets one alert per
 * severity and source through per window while escalations still go out.
 */
@Component
@RequiredArgsConstructor
public class NotificationPayloadFactory {

    static final String ANOMALY_TITLE = "Monitoring Platform Alert";
    static final String TEST_TITLE = "Test Alert - System Check";
    static final String TEST_MESSAGE = "This is a test alert to verify the alerting system configuration.";

    private static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    private final Clock clock;
    private final AlertingProperties properties;

    public NotificationPayload fromAnomaly(AnomalyEvent event) {
        CorrelatedPair pair = event.getSourcePair();
        Object errorRate = pair.getSeriesBRecord().getFields().get(ErrorRateAnomalyRule.ERROR_RATE_FIELD);
        Object responseTime = pair.getSeriesBRecord().getFields().get(ErrorRateAnomalyRule.RESPONSE_TIME_FIELD);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("confidence", String.format(Locale.ROOT, "%.2f", event.getConfidence()));
        metadata.put("error_rate", errorRate);
        metadata.put("response_time_ms", responseTime);
        metadata.put("series_a_timestamp", pair.getSeriesARecord().getTimestamp());
        metadata.put("series_b_timestamp", pair.getSeriesBRecord().getTimestamp());
        metadata.put("time_skew_seconds", pair.timeSkewSeconds());
        metadata.put("correlation_window_seconds", pair.getWindowSeconds());

        return NotificationPayload.builder()
                .title(ANOMALY_TITLE + " - " + event.getSeverity().name())
                .message(formatMessage(event, errorRate, responseTime))
                .severity(event.getSeverity())
                .source(properties.getSource())
                .timestamp(event.getTimestamp())
                .metadata(metadata)
                .build();
    }

    public NotificationPayload testAlert(String title, String message, Severity severity) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("test", true);
        metadata.put("system", "alerting-system");
        metadata.put("requested_at", TIME_FORMAT.format(clock.instant()));
        return NotificationPayload.builder()
                .title(title != null && !title.isBlank() ? title : TEST_TITLE)
                .message(message != null && !message.isBlank() ? message : TEST_MESSAGE)
                .severity(severity != null ? severity : Severity.INFO)
                .source(properties.getSource())
                .timestamp(clock.instant())
                .metadata(metadata)
                .build();
    }

    private static String formatMessage(AnomalyEvent event, Object errorRate, Object responseTime) {
        StringBuilder sb = new StringBuilder();
        sb.append("MONITORING ALERT\n\n")
                .append("Timestamp: ").append(TIME_FORMAT.format(event.getTimestamp())).append('\n')
                .append("Severity: ").append(event.getSeverity().name()).append('\n')
                .append(String.format(Locale.ROOT, "Confidence: %.2f%n%n", event.getConfidence()))
                .append("Detected Issues:\n");
        for (String finding : event.getMessages()) {
            sb.append("- ").append(finding).append('\n');
        }
        sb.append("\nMetrics:\n")
                .append("- Error Rate: ").append(formatRate(errorRate)).append('\n')
                .append("- Response Time: ").append(responseTime != null ? responseTime : 0).append("ms");
        return sb.toString();
    }

    private static String formatRate(Object errorRate) {
        if (errorRate instanceof Number) {
            return String.format(Locale.ROOT, "%.2f%%", ((Number) errorRate).doubleValue() * 100);
        }
        return String.valueOf(errorRate);
    }
}
