package com.monitoring.platform.anomaly;

import com.monitoring.platform.domain.AnomalyEvent;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Optional;

/**
 * Result of scoring one pair: an event, nothing, or a failure description.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ScoringOutcome {

    AnomalyEvent event;
    String error;

    public static ScoringOutcome flagged(AnomalyEvent event) {
        return new ScoringOutcome(event, null);
    }

    public static ScoringOutcome clean() {
        return new ScoringOutcome(null, null);
    }

    public static ScoringOutcome failed(String error) {
        return new ScoringOutcome(null, error);
    }

    public boolean isFailed() {
        return error != null;
    }

    public Optional<AnomalyEvent> getEventOptional() {
        return Optional.ofNullable(event);
    }
}
