package com.monitoring.platform.audit;

import com.monitoring.platform.notification.DispatchResult;
import com.monitoring.platform.notification.NotificationPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/**
 * Writes one audit line per alert handed to the dispatcher, so every notification decision can be
 * traced from the application log alone.
 */
@Slf4j
@Component
public class AlertAuditLogger {

    public void logDispatch(NotificationPayload payload, DispatchResult result) {
        String channels = result.getChannels().entrySet().stream()
                .map(e -> e.getKey() + "=" + (e.getValue().isSuccess() ? "OK" : "FAILED"))
                .collect(Collectors.joining(","));
        log.info("[AUDIT] ALERT_DISPATCHED alertId={} severity={} source={} title={} channels=[{}] success={}",
                payload.getAlertId(),
                payload.getSeverity(),
                payload.getSource(),
                payload.getTitle(),
                channels,
                result.isSuccess());
    }

    public void logRateLimited(NotificationPayload payload) {
        log.info("[AUDIT] ALERT_RATE_LIMITED alertId={} severity={} source={} title={}",
                payload.getAlertId(),
                payload.getSeverity(),
                payload.getSource(),
                payload.getTitle());
    }
}
