package com.monitoring.platform.orchestrator;

/**
 * Stages of a processing cycle. {@link #DONE} and {@link #ERRORED} are terminal.
 */
public enum CycleState {
    FETCHING,
    CORRELATING,
    SCORING,
    DISPATCHING,
    DONE,
    ERRORED
}
