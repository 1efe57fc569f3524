package com.monitoring.platform.notification;

import com.monitoring.platform.audit.AlertAuditLogger;
import com.monitoring.platform.config.AlertingProperties;
import com.monitoring.platform.domain.Severity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fans a notification out to its channels. Channels are attempted concurrently and independently;
 * the whole dispatch waits at most {@code deliveryTimeoutMs}, after which unfinished channels are
 * reported as timed out. Results are collected on the calling thread in channel order.
 * <p>
 * Without an explicit channel list the fan-out follows severity: each enabled channel whose
 * minimum severity is reached takes part.
 */
@Slf4j
@Service
public class NotificationDispatcher {

    private final Map<ChannelType, NotificationChannel> channelsByType;
    private final DispatchRateLimiter rateLimiter;
    private final ExecutorService executor;
    private final AlertAuditLogger auditLogger;
    private final long deliveryTimeoutMs;

    public NotificationDispatcher(List<NotificationChannel> channels,
                                  DispatchRateLimiter rateLimiter,
                                  @Qualifier("notificationExecutor") ExecutorService executor,
                                  AlertAuditLogger auditLogger,
                                  AlertingProperties properties) {
        this.channelsByType = new EnumMap<>(ChannelType.class);
        for (NotificationChannel channel : channels) {
            this.channelsByType.put(channel.getChannelType(), channel);
        }
        this.rateLimiter = rateLimiter;
        this.executor = executor;
        this.auditLogger = auditLogger;
        this.deliveryTimeoutMs = properties.getDeliveryTimeoutMs();
        log.info("Notification dispatcher registered channels: {}", channelStatus());
    }

    public DispatchResult dispatch(NotificationPayload payload) {
        return dispatch(payload, null);
    }

    /**
     * Dispatch to the given channels, or to the severity-selected channels when {@code requested}
     * is null or empty.
     */
    public DispatchResult dispatch(NotificationPayload payload, Collection<ChannelType> requested) {
        if (!rateLimiter.tryAcquire(payload)) {
            log.warn("Alert rate limited: alertId={} title={} source={}",
                    payload.getAlertId(), payload.getTitle(), payload.getSource());
            auditLogger.logRateLimited(payload);
            return DispatchResult.rateLimited(payload);
        }

        DispatchResult result;
        try {
            result = fanOut(payload, requested);
        } finally {
            rateLimiter.release(payload);
        }
        log.info("Alert dispatch completed: alertId={} severity={} channelsAttempted={} channelsSucceeded={} success={}",
                payload.getAlertId(), payload.getSeverity(), result.getChannelsAttempted(),
                result.getChannelsSucceeded(), result.isSuccess());
        auditLogger.logDispatch(payload, result);
        return result;
    }

    private DispatchResult fanOut(NotificationPayload payload, Collection<ChannelType> requested) {
        List<ChannelType> targets = requested == null || requested.isEmpty()
                ? selectChannels(payload.getSeverity())
                : new ArrayList<>(new LinkedHashSet<>(requested));
        if (targets.isEmpty()) {
            log.warn("No channels enabled for alert {} at severity {}", payload.getAlertId(), payload.getSeverity());
        }

        Map<ChannelType, CompletableFuture<DeliveryResult>> pending = new LinkedHashMap<>();
        for (ChannelType type : targets) {
            pending.put(type, submit(type, payload));
        }

        Map<ChannelType, DeliveryResult> results = new LinkedHashMap<>();
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(deliveryTimeoutMs);
        for (Map.Entry<ChannelType, CompletableFuture<DeliveryResult>> entry : pending.entrySet()) {
            results.put(entry.getKey(), await(entry.getKey(), entry.getValue(), deadline));
        }

        DispatchResult result = DispatchResult.of(payload, results);
        if (result.isSuccess()) {
            rateLimiter.recordSuccess(payload);
        }
        return result;
    }

    /**
     * Channels that receive an alert of this severity by default, in {@link ChannelType} order.
     */
    public List<ChannelType> selectChannels(Severity severity) {
        List<ChannelType> selected = new ArrayList<>();
        for (NotificationChannel channel : channelsByType.values()) {
            if (channel.isEnabled() && severity.isAtLeast(channel.getMinSeverity())) {
                selected.add(channel.getChannelType());
            }
        }
        return selected;
    }

    /** Enabled flag per registered channel. */
    public Map<ChannelType, Boolean> channelStatus() {
        Map<ChannelType, Boolean> status = new EnumMap<>(ChannelType.class);
        channelsByType.forEach((type, channel) -> status.put(type, channel.isEnabled()));
        return Collections.unmodifiableMap(status);
    }

    public Map<ChannelType, NotificationChannel> getChannels() {
        return Collections.unmodifiableMap(channelsByType);
    }

    private CompletableFuture<DeliveryResult> submit(ChannelType type, NotificationPayload payload) {
        NotificationChannel channel = channelsByType.get(type);
        if (channel == null) {
            return CompletableFuture.completedFuture(DeliveryResult.failed("Unknown channel: " + type));
        }
        try {
            return CompletableFuture.supplyAsync(() -> channel.deliver(payload), executor);
        } catch (RejectedExecutionException e) {
            log.error("Delivery executor rejected {} delivery for alert {}", type, payload.getAlertId());
            return CompletableFuture.completedFuture(DeliveryResult.failed("Delivery rejected: executor unavailable"));
        }
    }

    private DeliveryResult await(ChannelType type, CompletableFuture<DeliveryResult> future, long deadlineNanos) {
        long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
        try {
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("Delivery via {} timed out after {}ms", type, deliveryTimeoutMs);
            return DeliveryResult.failed("Delivery timed out after " + deliveryTimeoutMs + "ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DeliveryResult.failed("Delivery interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Delivery via {} failed unexpectedly", type, cause);
            return DeliveryResult.failed(cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName());
        }
    }
}
