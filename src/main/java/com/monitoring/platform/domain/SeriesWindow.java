package com.monitoring.platform.domain;

import lombok.Value;

import java.util.List;

/**
 * Result of one windowed fetch: both series for the look-back interval. When the fetch failed
 * the window is empty and {@link #unavailableReason} says why; absence of data is not a cycle error.
 */
@Value
public class SeriesWindow {

    List<TimedRecord> seriesA;
    List<TimedRecord> seriesB;
    String unavailableReason;

    public static SeriesWindow of(List<TimedRecord> seriesA, List<TimedRecord> seriesB) {
        return new SeriesWindow(List.copyOf(seriesA), List.copyOf(seriesB), null);
    }

    public static SeriesWindow unavailable(String reason) {
        return new SeriesWindow(List.of(), List.of(), reason);
    }

    public boolean isAvailable() {
        return unavailableReason == null;
    }
}
