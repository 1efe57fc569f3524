package com.monitoring.platform.notification;

import com.monitoring.platform.domain.Severity;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Channel-agnostic alert content. Each channel renders its own representation from it.
 */
@Value
public class NotificationPayload {

    String alertId;
    String title;
    String message;
    Severity severity;
    String source;
    Instant timestamp;
    Map<String, Object> metadata;

    @Builder
    public NotificationPayload(String alertId, String title, String message, Severity severity,
                               String source, Instant timestamp, Map<String, Object> metadata) {
        this.title = title;
        this.message = message;
        this.severity = severity;
        this.source = source;
        this.timestamp = timestamp;
        this.metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.alertId = alertId != null ? alertId : defaultAlertId(source, timestamp, title);
    }

    /** source_epochSeconds_titleHash. */
    static String defaultAlertId(String source, Instant timestamp, String title) {
        long epoch = timestamp != null ? timestamp.getEpochSecond() : 0L;
        return source + "_" + epoch + "_" + Integer.toHexString(String.valueOf(title).hashCode());
    }

    /** Key used by the dispatcher's rate limiter. */
    public String rateLimitKey() {
        return source + "_" + title;
    }
}
