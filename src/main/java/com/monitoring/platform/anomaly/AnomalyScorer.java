package com.monitoring.platform.anomaly;

import com.monitoring.platform.domain.AnomalyEvent;
import com.monitoring.platform.domain.CorrelatedPair;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Runs the configured {@link AnomalyRule} over correlated pairs. Scoring is best-effort per pair:
 * a pair that fails to score is logged and left out, the rest of the batch continues.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnomalyScorer {

    private final AnomalyRule rule;

    public ScoringOutcome score(CorrelatedPair pair) {
        try {
            Optional<AnomalyEvent> event = rule.evaluate(pair);
            return event.map(ScoringOutcome::flagged).orElseGet(ScoringOutcome::clean);
        } catch (Exception e) {
            return ScoringOutcome.failed(rule.getName() + " failed: " + e.getMessage());
        }
    }

    /**
     * Scores every pair and returns the events in input order.
     */
    public List<AnomalyEvent> scoreBatch(List<CorrelatedPair> pairs) {
        List<AnomalyEvent> events = new ArrayList<>();
        int failures = 0;
        for (CorrelatedPair pair : pairs) {
            ScoringOutcome outcome = score(pair);
            if (outcome.isFailed()) {
                failures++;
                log.error("Scoring failed for pair seriesA.ts={} seriesB.ts={}: {}",
                        pair.getSeriesARecord().getTimestamp(), pair.getSeriesBRecord().getTimestamp(),
                        outcome.getError());
                continue;
            }
            outcome.getEventOptional().ifPresent(event -> {
                log.warn("Anomaly detected: severity={} confidence={} findings={}",
                        event.getSeverity(), String.format(Locale.ROOT, "%.2f", event.getConfidence()), event.getMessages());
                events.add(event);
            });
        }
        log.info("Anomaly scoring completed: pairs={} anomalies={} failures={} rule={}",
                pairs.size(), events.size(), failures, rule.getName());
        return events;
    }
}
