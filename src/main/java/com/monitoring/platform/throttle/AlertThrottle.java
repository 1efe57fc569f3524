package com.monitoring.platform.throttle;

import com.monitoring.platform.domain.AnomalyEvent;
import com.monitoring.platform.domain.Severity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decides whether an anomaly is worth alerting on. Low-confidence events are dropped, CRITICAL
 * events always pass, everything else is de-duplicated on severity + event second.
 * <p>
 * The key is deliberately coarse: two different anomalies with the same severity created in the
 * same second collide and only the first is admitted. History keeps the 100 most recently
 * recorded keys and lives for the lifetime of the process; it is independent of the
 * dispatcher's source/title rate limit.
 */
@Slf4j
@Component
public class AlertThrottle {

    static final double MIN_CONFIDENCE = 0.3;
    static final int MAX_HISTORY = 100;

    private final Clock clock;
    private final LinkedHashMap<String, Instant> history = new LinkedHashMap<>();

    public AlertThrottle(Clock clock) {
        this.clock = clock;
    }

    public synchronized boolean admit(AnomalyEvent event) {
        if (event.getConfidence() < MIN_CONFIDENCE) {
            log.debug("Throttle rejected low-confidence anomaly: severity={} confidence={}",
                    event.getSeverity(), event.getConfidence());
            return false;
        }

        String key = keyFor(event);
        if (event.getSeverity() != Severity.CRITICAL && history.containsKey(key)) {
            log.info("Throttle suppressed duplicate anomaly key={}", key);
            return false;
        }

        record(key);
        return true;
    }

    public synchronized int historySize() {
        return history.size();
    }

    public synchronized boolean hasRecorded(AnomalyEvent event) {
        return history.containsKey(keyFor(event));
    }

    static String keyFor(AnomalyEvent event) {
        return event.getSeverity().name() + "_" + event.getTimestamp().getEpochSecond();
    }

    private void record(String key) {
        // re-insert so a re-recorded key counts as most recent
        history.remove(key);
        history.put(key, clock.instant());
        Iterator<Map.Entry<String, Instant>> it = history.entrySet().iterator();
        while (history.size() > MAX_HISTORY && it.hasNext()) {
            it.next();
            it.remove();
        }
    }
}
