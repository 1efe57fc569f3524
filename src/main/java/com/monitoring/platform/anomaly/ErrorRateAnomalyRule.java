package com.monitoring.platform.anomaly;

import com.monitoring.platform.domain.AnomalyEvent;
import com.monitoring.platform.domain.CorrelatedPair;
import com.monitoring.platform.domain.Severity;
import com.monitoring.platform.domain.TimedRecord;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Flags a pair when the application-side error rate exceeds the threshold.
 * Severity is banded from the error rate; confidence grows with corroborating data
 * (response time on the application side, a value on the infrastructure side, a tight match).
 */
@Slf4j
public class ErrorRateAnomalyRule implements AnomalyRule {

    public static final String ERROR_RATE_FIELD = "error_rate";
    public static final String RESPONSE_TIME_FIELD = "response_time_ms";
    public static final String VALUE_FIELD = "lastvalue";

    static final double BASE_CONFIDENCE = 0.5;
    static final double RESPONSE_TIME_BONUS = 0.2;
    static final double VALUE_BONUS = 0.2;
    static final double TIGHT_WINDOW_BONUS = 0.1;
    static final long TIGHT_WINDOW_SECONDS = 5;

    private final double threshold;
    private final Clock clock;

    public ErrorRateAnomalyRule(double threshold, Clock clock) {
        this.threshold = threshold;
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "error-rate";
    }

    @Override
    public Optional<AnomalyEvent> evaluate(CorrelatedPair pair) {
        double errorRate = errorRate(pair.getSeriesBRecord());

        List<String> findings = new ArrayList<>();
        if (errorRate > threshold) {
            findings.add(String.format(Locale.ROOT, "High error rate in application: %.2f%% (threshold %.2f%%)",
                    errorRate * 100, threshold * 100));
        }
        if (findings.isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(AnomalyEvent.builder()
                .timestamp(clock.instant())
                .sourcePair(pair)
                .messages(findings)
                .severity(Severity.fromIndicator(errorRate))
                .confidence(confidence(pair))
                .build());
    }

    /**
     * 0.5 base, +0.2 with a response time, +0.2 with an infrastructure value, +0.1 when the two
     * timestamps are at most 5s apart; capped at 1.0.
     */
    double confidence(CorrelatedPair pair) {
        double score = BASE_CONFIDENCE;
        if (pair.getSeriesBRecord().isPopulated(RESPONSE_TIME_FIELD)) {
            score += RESPONSE_TIME_BONUS;
        }
        if (pair.getSeriesARecord().isPopulated(VALUE_FIELD)) {
            score += VALUE_BONUS;
        }
        if (pair.timeSkewSeconds() <= TIGHT_WINDOW_SECONDS) {
            score += TIGHT_WINDOW_BONUS;
        }
        return Math.min(score, 1.0);
    }

    /** Missing error rate reads as 0; a value that is not a number is malformed input. */
    static double errorRate(TimedRecord record) {
        Object raw = record.getFields().get(ERROR_RATE_FIELD);
        if (raw == null) {
            return 0.0;
        }
        if (raw instanceof Number) {
            return ((Number) raw).doubleValue();
        }
        try {
            return Double.parseDouble(raw.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed " + ERROR_RATE_FIELD + " value: '" + raw + "'", e);
        }
    }
}
