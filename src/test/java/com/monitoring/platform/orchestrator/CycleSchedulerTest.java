package com.monitoring.platform.orchestrator;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CycleSchedulerTest {

    @Mock
    private MonitoringCycleOrchestrator orchestrator;

    @InjectMocks
    private CycleScheduler scheduler;

    private static CycleSummary summary(boolean success) {
        return CycleSummary.builder()
                .cycleId("cycle")
                .success(success)
                .finalState(success ? CycleState.DONE : CycleState.ERRORED)
                .metrics(new CycleMetrics())
                .errors(success ? List.of() : List.of("Critical error in processing cycle: boom"))
                .build();
    }

    @Test
    void failedCycleIsCountedAndLoopContinues() {
        when(orchestrator.runCycle()).thenReturn(summary(false), summary(true));

        scheduler.runScheduledCycle();
        scheduler.runScheduledCycle();

        assertThat(scheduler.getCycleCount()).isEqualTo(2);
        assertThat(scheduler.getFailedCycles()).isEqualTo(1);
    }

    @Test
    void stoppedOrchestratorIsNotInvoked() {
        when(orchestrator.isStopped()).thenReturn(true);

        scheduler.runScheduledCycle();

        verify(orchestrator, never()).runCycle();
        assertThat(scheduler.getCycleCount()).isZero();
    }

    @Test
    void shutdownStopsTheOrchestrator() {
        scheduler.shutdown();

        verify(orchestrator).stop();
    }
}
