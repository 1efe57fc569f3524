package com.monitoring.platform.notification;

import com.monitoring.platform.config.AlertingProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Source-level rate limit for the dispatcher, keyed by source + title. A key that was
 * successfully dispatched within the window is refused; entries older than twice the window are
 * pruned on every write. A dispatch reserves its key with {@link #tryAcquire} so that a concurrent
 * dispatch of the same key is refused while the first is still in flight. Independent of {@link com.monitoring.platform.throttle.AlertThrottle}.
 */
@Component
public class DispatchRateLimiter {

    private final Clock clock;
    private final Duration window;
    private final Map<String, Instant> lastSent = new HashMap<>();
    private final Set<String> inFlight = new HashSet<>();

    @Autowired
    public DispatchRateLimiter(Clock clock, AlertingProperties properties) {
        this(clock, Duration.ofSeconds(properties.getRateLimitWindowSeconds()));
    }

    public DispatchRateLimiter(Clock clock, Duration window) {
        this.clock = clock;
        this.window = window;
    }

    public synchronized boolean isRateLimited(NotificationPayload payload) {
        Instant last = lastSent.get(payload.rateLimitKey());
        if (last == null) {
            return false;
        }
        return Duration.between(last, clock.instant()).compareTo(window) < 0;
    }

    /**
     * Reserves the payload's key for a dispatch. Returns false when the key is rate limited or
     * another dispatch of it is in flight. A successful reservation must end with
     * {@link #recordSuccess} or {@link #release}.
     */
    public synchronized boolean tryAcquire(NotificationPayload payload) {
        String key = payload.rateLimitKey();
        if (inFlight.contains(key) || isRateLimited(payload)) {
            return false;
        }
        inFlight.add(key);
        return true;
    }

    /** Drops a reservation without recording a send. */
    public synchronized void release(NotificationPayload payload) {
        inFlight.remove(payload.rateLimitKey());
    }

    public synchronized void recordSuccess(NotificationPayload payload) {
        Instant now = clock.instant();
        inFlight.remove(payload.rateLimitKey());
        lastSent.put(payload.rateLimitKey(), now);
        Duration retention = window.multipliedBy(2);
        lastSent.values().removeIf(sentAt -> Duration.between(sentAt, now).compareTo(retention) >= 0);
    }

    public synchronized int size() {
        return lastSent.size();
    }
}
