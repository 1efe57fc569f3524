package com.monitoring.platform.notification;

import com.monitoring.platform.domain.Severity;

/**
 * A delivery channel. Implementations render the payload in their own format and must not throw
 * out of {@link #deliver}: every failure comes back as {@link DeliveryResult#failed(String)}.
 */
public interface NotificationChannel {

    ChannelType getChannelType();

    /** Whether the channel is switched on and has an endpoint. */
    boolean isEnabled();

    /** Lowest severity this channel receives when the caller does not pick channels. */
    Severity getMinSeverity();

    DeliveryResult deliver(NotificationPayload payload);
}
