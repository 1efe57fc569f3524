package com.monitoring.platform.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Anomaly raised for a correlated pair. Only exists when at least one finding fired,
 * so {@link #messages} is never empty.
 */
@Value
public class AnomalyEvent {

    /** Creation time of the event. */
    Instant timestamp;
    CorrelatedPair sourcePair;
    List<String> messages;
    Severity severity;
    /** 0.0–1.0; how much corroborating data backs the finding. */
    double confidence;

    @Builder
    public AnomalyEvent(Instant timestamp, CorrelatedPair sourcePair, List<String> messages,
                        Severity severity, double confidence) {
        if (messages == null || messages.isEmpty()) {
            throw new IllegalArgumentException("An anomaly event needs at least one finding message");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1], was " + confidence);
        }
        this.timestamp = timestamp;
        this.sourcePair = sourcePair;
        this.messages = List.copyOf(messages);
        this.severity = severity;
        this.confidence = confidence;
    }
}
