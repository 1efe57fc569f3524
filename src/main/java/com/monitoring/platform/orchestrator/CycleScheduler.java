package com.monitoring.platform.orchestrator;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Continuous mode: runs a cycle, waits the fetch interval, runs the next. A failed cycle is
 * logged and does not stop the loop; shutdown stops the orchestrator so no new stage starts.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "monitoring.processing.continuous.enabled", havingValue = "true", matchIfMissing = true)
public class CycleScheduler {

    private final MonitoringCycleOrchestrator orchestrator;
    private final AtomicLong cycleCount = new AtomicLong();
    private final AtomicLong failedCycles = new AtomicLong();

    @Scheduled(fixedDelayString = "${monitoring.processing.fetch-interval-minutes:5}",
            initialDelay = 0, timeUnit = TimeUnit.MINUTES)
    public void runScheduledCycle() {
        if (orchestrator.isStopped()) {
            return;
        }
        long count = cycleCount.incrementAndGet();
        log.info("Starting continuous cycle #{}", count);
        CycleSummary summary = orchestrator.runCycle();
        if (!summary.isSuccess()) {
            long failed = failedCycles.incrementAndGet();
            log.error("Continuous cycle #{} failed ({} failed so far): {}", count, failed, summary.getErrors());
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Stopping continuous processing after {} cycles ({} failed)", cycleCount.get(), failedCycles.get());
        orchestrator.stop();
    }

    public long getCycleCount() {
        return cycleCount.get();
    }

    public long getFailedCycles() {
        return failedCycles.get();
    }
}
