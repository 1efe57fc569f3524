package com.monitoring.platform.orchestrator;

import lombok.Data;

/**
 * Counters collected while a cycle runs.
 */
@Data
public class CycleMetrics {

    private int recordsA;
    private int recordsB;
    private int correlations;
    private int anomalies;
    private int alertsAdmitted;
    private int alertsDispatched;
}
