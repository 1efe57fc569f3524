package com.monitoring.platform.orchestrator;

/**
 * Receives every finished cycle summary.
 */
public interface CycleSummaryListener {

    void onCycleCompleted(CycleSummary summary);
}
