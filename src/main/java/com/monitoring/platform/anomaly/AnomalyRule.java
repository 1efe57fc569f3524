package com.monitoring.platform.anomaly;

import com.monitoring.platform.domain.AnomalyEvent;
import com.monitoring.platform.domain.CorrelatedPair;

import java.util.Optional;

/**
 * Scoring policy applied to each correlated pair. The default is {@link ErrorRateAnomalyRule};
 * register another bean of this type to replace it (e.g. a multi-metric rule).
 * <p>
 * Implementations return empty when nothing fired and may throw on malformed input;
 * {@link AnomalyScorer} turns exceptions into per-pair failures.
 */
public interface AnomalyRule {

    String getName();

    Optional<AnomalyEvent> evaluate(CorrelatedPair pair);
}
