package com.monitoring.platform.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A Series A record and a Series B record whose timestamps fall within the correlation window.
 * Holds {@code |a.timestamp - b.timestamp| <= windowSeconds}.
 */
@Value
@Builder
public class CorrelatedPair {

    /** Infrastructure-side record (e.g. a monitoring item with lastclock/lastvalue). */
    TimedRecord seriesARecord;
    /** Application-side record (e.g. timestamp/error_rate/response_time_ms). */
    TimedRecord seriesBRecord;
    /** Wall-clock time the pair was matched, not a data timestamp. */
    Instant correlationTimestamp;
    long windowSeconds;

    public long timeSkewSeconds() {
        return Math.abs(seriesARecord.getTimestamp() - seriesBRecord.getTimestamp());
    }
}
