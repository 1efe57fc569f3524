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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Priority channel: posts a flat JSON document to a generic webhook endpoint.
 * Non-2xx responses count as failures.
 */
@Component
public class WebhookNotificationChannel extends AbstractNotificationChannel {

    private final RestTemplate restTemplate;
    private final AlertingProperties.Webhook config;

    public WebhookNotificationChannel(@Qualifier("notificationRestTemplate") RestTemplate restTemplate,
                                      AlertingProperties properties,
                                      CircuitBreakerRegistry circuitBreakerRegistry, RetryRegistry retryRegistry) {
        super(ChannelType.WEBHOOK, circuitBreakerRegistry, retryRegistry);
        this.restTemplate = restTemplate;
        this.config = properties.getWebhook();
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled() && config.getUrl() != null && !config.getUrl().isBlank();
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
                config.getUrl(), new HttpEntity<>(buildDocument(payload), headers), String.class);
        return "Webhook sent (HTTP " + response.getStatusCode().value() + ")";
    }

    static Map<String, Object> buildDocument(NotificationPayload payload) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("alert_id", payload.getAlertId());
        document.put("title", payload.getTitle());
        document.put("message", payload.getMessage());
        document.put("severity", payload.getSeverity().name().toLowerCase());
        document.put("source", payload.getSource());
        document.put("timestamp", payload.getTimestamp() != null ? payload.getTimestamp().getEpochSecond() : null);
        document.put("metadata", payload.getMetadata());
        return document;
    }
}
