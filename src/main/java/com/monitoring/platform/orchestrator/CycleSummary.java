package com.monitoring.platform.orchestrator;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one processing cycle. {@code success} is false only when the cycle itself failed;
 * empty windows, no correlations and no anomalies are successful cycles.
 */
@Value
@Builder
public class CycleSummary {

    String cycleId;
    Instant startTime;
    Instant endTime;
    long durationMs;
    boolean success;
    CycleState finalState;
    CycleMetrics metrics;
    List<String> errors;
}
