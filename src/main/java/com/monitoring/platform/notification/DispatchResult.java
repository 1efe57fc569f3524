package com.monitoring.platform.notification;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregated outcome of dispatching one payload. {@code success} means at least one channel
 * delivered; inspect {@link #channels} to detect partial failure.
 */
@Value
@Builder
public class DispatchResult {

    String alertId;
    Instant timestamp;
    boolean rateLimited;
    Map<ChannelType, DeliveryResult> channels;

    public static DispatchResult rateLimited(NotificationPayload payload) {
        return DispatchResult.builder()
                .alertId(payload.getAlertId())
                .timestamp(payload.getTimestamp())
                .rateLimited(true)
                .channels(Map.of())
                .build();
    }

    public static DispatchResult of(NotificationPayload payload, Map<ChannelType, DeliveryResult> channels) {
        return DispatchResult.builder()
                .alertId(payload.getAlertId())
                .timestamp(payload.getTimestamp())
                .rateLimited(false)
                .channels(Collections.unmodifiableMap(new LinkedHashMap<>(channels)))
                .build();
    }

    public int getChannelsAttempted() {
        return channels.size();
    }

    public int getChannelsSucceeded() {
        return (int) channels.values().stream().filter(DeliveryResult::isSuccess).count();
    }

    public boolean isSuccess() {
        return getChannelsSucceeded() > 0;
    }
}
