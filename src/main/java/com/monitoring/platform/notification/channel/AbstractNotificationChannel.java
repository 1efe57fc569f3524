package com.monitoring.platform.notification.channel;

import com.monitoring.platform.notification.ChannelType;
import com.monitoring.platform.notification.DeliveryResult;
import com.monitoring.platform.notification.NotificationChannel;
import com.monitoring.platform.notification.NotificationPayload;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.function.Supplier;

/**
 * Base for channels that talk to an external transport. Wraps {@link #send} with retry and a
 * per-channel circuit breaker, and converts every failure into a {@link DeliveryResult}.
 */
@Slf4j
public abstract class AbstractNotificationChannel implements NotificationChannel {

    static final String RETRY_INSTANCE = "notification";

    private static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    private final ChannelType channelType;
    private final CircuitBreaker circuitBreaker;
    private final Retry retry;

    protected AbstractNotificationChannel(ChannelType channelType,
                                          CircuitBreakerRegistry circuitBreakerRegistry,
                                          RetryRegistry retryRegistry) {
        this.channelType = channelType;
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker("notification-" + channelType.name().toLowerCase());
        this.retry = retryRegistry.retry(RETRY_INSTANCE);
    }

    @Override
    public final ChannelType getChannelType() {
        return channelType;
    }

    @Override
    public final DeliveryResult deliver(NotificationPayload payload) {
        if (!isEnabled()) {
            return DeliveryResult.failed(channelType.name().toLowerCase() + " not configured");
        }
        Supplier<String> supplier = () -> send(payload);
        Supplier<String> withRetry = Retry.decorateSupplier(retry, supplier);
        Supplier<String> withCb = CircuitBreaker.decorateSupplier(circuitBreaker, withRetry);
        try {
            String message = withCb.get();
            log.debug("Delivered alert {} via {}: {}", payload.getAlertId(), channelType, message);
            return DeliveryResult.delivered(message);
        } catch (CallNotPermittedException e) {
            log.warn("Circuit open for channel {}; skipping alert {}", channelType, payload.getAlertId());
            return DeliveryResult.failed("circuit open for " + channelType.name().toLowerCase());
        } catch (Exception e) {
            log.error("Delivery via {} failed for alert {}: {}", channelType, payload.getAlertId(), e.getMessage());
            return DeliveryResult.failed(describe(e));
        }
    }

    /**
     * Push the payload through the transport. Throw on any failure; return an informational message.
     */
    protected abstract String send(NotificationPayload payload);

    protected static String formatTime(Instant instant) {
        return instant != null ? TIME_FORMAT.format(instant) : "unknown";
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message != null && !message.isBlank() ? message : e.getClass().getSimpleName();
    }
}
