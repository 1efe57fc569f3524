package com.monitoring.platform.notification;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of one delivery attempt on one channel.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DeliveryResult {

    boolean success;
    /** Informational message on success. */
    String message;
    /** Failure description; null on success. */
    String error;

    public static DeliveryResult delivered(String message) {
        return new DeliveryResult(true, message, null);
    }

    public static DeliveryResult failed(String error) {
        return new DeliveryResult(false, null, error);
    }
}
