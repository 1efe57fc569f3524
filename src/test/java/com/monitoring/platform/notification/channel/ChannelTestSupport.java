package com.monitoring.platform.notification.channel;

import com.monitoring.platform.domain.Severity;
import com.monitoring.platform.notification.NotificationPayload;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

final class ChannelTestSupport {

    private ChannelTestSupport() {
    }

    static RetryRegistry retries(int maxAttempts) {
        return RetryRegistry.of(RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .waitDuration(Duration.ofMillis(1))
                .build());
    }

    static CircuitBreakerRegistry breakers() {
        return CircuitBreakerRegistry.ofDefaults();
    }

    static NotificationPayload payload(Severity severity) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("error_rate", 0.9);
        metadata.put("confidence", "0.80");
        return NotificationPayload.builder()
                .alertId("monitoring-platform_1700000000_abc")
                .title("Monitoring Platform Alert - " + severity.name())
                .message("High error rate\nsecond line <b>")
                .severity(severity)
                .source("monitoring-platform")
                .timestamp(Instant.ofEpochSecond(1_700_000_000L))
                .metadata(metadata)
                .build();
    }
}
