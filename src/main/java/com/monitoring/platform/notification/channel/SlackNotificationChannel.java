package com.monitoring.platform.notification.channel;

import com.monitoring.platform.config.AlertingProperties;
import com.monitoring.platform.domain.Severity;
import com.monitoring.platform.notification.ChannelType;
import com.monitoring.platform.notification.NotificationPayload;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Broadcast channel: posts a Slack incoming-webhook message with one attachment
 * (colour by severity, fields for source/severity/time/alert id plus metadata).
 */
@Component
public class SlackNotificationChannel extends AbstractNotificationChannel {

    private static final Map<Severity, String> COLORS = Map.of(
            Severity.CRITICAL, "danger",
            Severity.HIGH, "warning",
            Severity.MEDIUM, "warning",
            Severity.LOW, "good",
            Severity.INFO, "#17a2b8");

    private static final Map<Severity, String> EMOJIS = Map.of(
            Severity.CRITICAL, ":red_circle:",
            Severity.HIGH, ":large_orange_circle:",
            Severity.MEDIUM, ":large_yellow_circle:",
            Severity.LOW, ":large_green_circle:",
            Severity.INFO, ":large_blue_circle:");

    private final RestTemplate restTemplate;
    private final AlertingProperties.Slack config;

    public SlackNotificationChannel(@Qualifier("notificationRestTemplate") RestTemplate restTemplate,
                                    AlertingProperties properties,
                                    CircuitBreakerRegistry circuitBreakerRegistry, RetryRegistry retryRegistry) {
        super(ChannelType.SLACK, circuitBreakerRegistry, retryRegistry);
        this.restTemplate = restTemplate;
        this.config = properties.getSlack();
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled() && config.getWebhookUrl() != null && !config.getWebhookUrl().isBlank();
    }

    @Override
    public Severity getMinSeverity() {
        return config.getMinSeverity();
    }

    @Override
    protected String send(NotificationPayload payload) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        ResponseEntity<String> response = restTemplate.postForEntity(
                config.getWebhookUrl(), new HttpEntity<>(buildMessage(payload), headers), String.class);
        return "Slack message sent (HTTP " + response.getStatusCode().value() + ")";
    }

    static Map<String, Object> buildMessage(NotificationPayload payload) {
        List<Map<String, Object>> fields = new ArrayList<>();
        fields.add(field("Source", payload.getSource()));
        fields.add(field("Severity", payload.getSeverity().name()));
        fields.add(field("Time", formatTime(payload.getTimestamp())));
        fields.add(field("Alert ID", "`" + payload.getAlertId() + "`"));
        payload.getMetadata().forEach((key, value) -> fields.add(field(key, String.valueOf(value))));

        Map<String, Object> attachment = new LinkedHashMap<>();
        attachment.put("color", COLORS.getOrDefault(payload.getSeverity(), "#6c757d"));
        attachment.put("title", EMOJIS.getOrDefault(payload.getSeverity(), ":white_circle:") + " " + payload.getTitle());
        attachment.put("text", payload.getMessage());
        attachment.put("fields", fields);
        attachment.put("ts", payload.getTimestamp() != null ? payload.getTimestamp().getEpochSecond() : 0L);

        return Map.of("attachments", List.of(attachment));
    }

    private static Map<String, Object> field(String title, String value) {
        Map<String, Object> field = new LinkedHashMap<>();
        field.put("title", title);
        field.put("value", value);
        field.put("short", true);
        return field;
    }
}
