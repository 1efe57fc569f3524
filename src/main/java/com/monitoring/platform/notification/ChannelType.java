package com.monitoring.platform.notification;

/**
 * Delivery channels. Declaration order is the order channels are attempted and reported in.
 */
public enum ChannelType {
    /** Primary channel: every severity. */
    EMAIL,
    /** Broadcast channel: team chat. */
    SLACK,
    /** Priority channel: generic JSON webhook (paging/ticketing integrations). */
    WEBHOOK,
    SMS
}
