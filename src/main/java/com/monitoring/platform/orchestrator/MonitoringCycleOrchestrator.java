package com.monitoring.platform.orchestrator;

import com.monitoring.platform.anomaly.AnomalyScorer;
import com.monitoring.platform.correlation.CorrelationEngine;
import com.monitoring.platform.datasource.WindowedDataSource;
import com.monitoring.platform.domain.AnomalyEvent;
import com.monitoring.platform.domain.CorrelatedPair;
import com.monitoring.platform.domain.SeriesWindow;
import com.monitoring.platform.notification.DispatchResult;
import com.monitoring.platform.notification.NotificationDispatcher;
import com.monitoring.platform.notification.NotificationPayload;
import com.monitoring.platform.notification.NotificationPayloadFactory;
import com.monitoring.platform.throttle.AlertThrottle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs one monitoring cycle: fetch, correlate, score, throttle and dispatch.
 * <p>
 * Cycles never overlap; the lock also serialises access to the throttle and rate-limit
 * histories, which outlive individual cycles. Anything escaping the per-pair and per-channel
 * boundaries ends the cycle in {@link CycleState#ERRORED}. A stop request lets the running stage
 * finish and prevents the next one from starting.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MonitoringCycleOrchestrator {

    private final WindowedDataSource dataSource;
    private final CorrelationEngine correlationEngine;
    private final AnomalyScorer anomalyScorer;
    private final AlertThrottle alertThrottle;
    private final NotificationPayloadFactory payloadFactory;
    private final NotificationDispatcher dispatcher;
    private final List<CycleSummaryListener> listeners;
    private final Clock clock;

    @Value("${monitoring.processing.correlation-window-seconds:10}")
    private long correlationWindowSeconds = 10;

    @Value("${monitoring.processing.fetch-interval-minutes:5}")
    private int fetchIntervalMinutes = 5;

    private final ReentrantLock cycleLock = new ReentrantLock();
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final AtomicLong cycleSequence = new AtomicLong();
    private volatile CycleState currentState = CycleState.DONE;

    public CycleSummary runCycle() {
        cycleLock.lock();
        try {
            CycleSummary summary = executeCycle();
            notifyListeners(summary);
            return summary;
        } finally {
            cycleLock.unlock();
        }
    }

    /** Stops further cycles and stages; the stage in progress completes. */
    public void stop() {
        if (stopped.compareAndSet(false, true)) {
            log.info("Stop requested; no new cycles or stages will start");
        }
    }

    public boolean isStopped() {
        return stopped.get();
    }

    /** State of the running cycle, or of the last one when idle. */
    public CycleState getCurrentState() {
        return currentState;
    }

    private CycleSummary executeCycle() {
        Instant start = clock.instant();
        String cycleId = "cycle_" + cycleSequence.incrementAndGet() + "_" + start.getEpochSecond();
        CycleMetrics metrics = new CycleMetrics();
        List<String> errors = new ArrayList<>();
        CycleState state;

        log.info("Starting processing cycle {}", cycleId);
        try {
            state = runStages(cycleId, metrics);
        } catch (Exception e) {
            log.error("Critical error in processing cycle {} during {}", cycleId, currentState, e);
            errors.add("Critical error in processing cycle: " + e.getMessage());
            state = CycleState.ERRORED;
        }
        currentState = state;

        Instant end = clock.instant();
        CycleSummary summary = CycleSummary.builder()
                .cycleId(cycleId)
                .startTime(start)
                .endTime(end)
                .durationMs(Duration.between(start, end).toMillis())
                .success(errors.isEmpty())
                .finalState(state)
                .metrics(metrics)
                .errors(List.copyOf(errors))
                .build();
        log.info("Processing cycle {} finished: state={} success={} recordsA={} recordsB={} correlations={} anomalies={} admitted={} dispatched={} durationMs={}",
                cycleId, summary.getFinalState(), summary.isSuccess(), metrics.getRecordsA(), metrics.getRecordsB(),
                metrics.getCorrelations(), metrics.getAnomalies(), metrics.getAlertsAdmitted(),
                metrics.getAlertsDispatched(), summary.getDurationMs());
        return summary;
    }

    private CycleState runStages(String cycleId, CycleMetrics metrics) {
        if (stopped.get()) {
            log.info("Cycle {} skipped: orchestrator stopped", cycleId);
            return CycleState.DONE;
        }

        currentState = CycleState.FETCHING;
        SeriesWindow window = dataSource.fetch(fetchIntervalMinutes);
        if (!window.isAvailable()) {
            log.warn("Cycle {}: no data available ({})", cycleId, window.getUnavailableReason());
            return CycleState.DONE;
        }
        metrics.setRecordsA(window.getSeriesA().size());
        metrics.setRecordsB(window.getSeriesB().size());
        if (window.getSeriesA().isEmpty() || window.getSeriesB().isEmpty()) {
            log.info("Cycle {}: insufficient data for correlation", cycleId);
            return CycleState.DONE;
        }
        if (stopped.get()) return CycleState.DONE;

        currentState = CycleState.CORRELATING;
        List<CorrelatedPair> pairs = correlationEngine.correlate(
                window.getSeriesA(), window.getSeriesB(), correlationWindowSeconds);
        metrics.setCorrelations(pairs.size());
        if (pairs.isEmpty()) {
            log.info("Cycle {}: no correlations found", cycleId);
            return CycleState.DONE;
        }
        if (stopped.get()) return CycleState.DONE;

        currentState = CycleState.SCORING;
        List<AnomalyEvent> anomalies = anomalyScorer.scoreBatch(pairs);
        metrics.setAnomalies(anomalies.size());
        if (anomalies.isEmpty()) {
            log.info("Cycle {}: no anomalies detected", cycleId);
            return CycleState.DONE;
        }

        currentState = CycleState.DISPATCHING;
        for (AnomalyEvent anomaly : anomalies) {
            if (stopped.get()) {
                log.info("Cycle {}: stop requested, remaining anomalies not dispatched", cycleId);
                break;
            }
            if (!alertThrottle.admit(anomaly)) {
                continue;
            }
            metrics.setAlertsAdmitted(metrics.getAlertsAdmitted() + 1);
            NotificationPayload payload = payloadFactory.fromAnomaly(anomaly);
            DispatchResult result = dispatcher.dispatch(payload);
            if (result.isSuccess()) {
                metrics.setAlertsDispatched(metrics.getAlertsDispatched() + 1);
            } else if (!result.isRateLimited()) {
                log.warn("Cycle {}: alert {} was not delivered on any channel", cycleId, payload.getAlertId());
            }
        }
        return CycleState.DONE;
    }

    private void notifyListeners(CycleSummary summary) {
        for (CycleSummaryListener listener : listeners) {
            try {
                listener.onCycleCompleted(summary);
            } catch (Exception e) {
                log.error("Cycle summary listener {} failed for {}", listener.getClass().getSimpleName(),
                        summary.getCycleId(), e);
            }
        }
    }
}
