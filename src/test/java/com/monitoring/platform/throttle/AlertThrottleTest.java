package com.monitoring.platform.throttle;

import com.monitoring.platform.domain.AnomalyEvent;
import com.monitoring.platform.domain.CorrelatedPair;
import com.monitoring.platform.domain.Severity;
import com.monitoring.platform.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.monitoring.platform.testutil.Records.seriesA;
import static com.monitoring.platform.testutil.Records.seriesB;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for AlertThrottle: confidence floor, CRITICAL bypass, duplicate keys and bounded history.
 */
class AlertThrottleTest {

    private MutableClock clock;
    private AlertThrottle throttle;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpochSecond(10_000L);
        throttle = new AlertThrottle(clock);
    }

    private static AnomalyEvent event(Severity severity, double confidence, long createdAtSecond) {
        CorrelatedPair pair = CorrelatedPair.builder()
                .seriesARecord(seriesA(1000, "1"))
                .seriesBRecord(seriesB(1000, 0.7))
                .correlationTimestamp(Instant.ofEpochSecond(createdAtSecond))
                .windowSeconds(10)
                .build();
        return AnomalyEvent.builder()
                .timestamp(Instant.ofEpochSecond(createdAtSecond))
                .sourcePair(pair)
                .messages(List.of("finding"))
                .severity(severity)
                .confidence(confidence)
                .build();
    }

    @Test
    void lowConfidenceIsRejectedEvenWhenCritical() {
        assertThat(throttle.admit(event(Severity.CRITICAL, 0.29, 10_000L))).isFalse();
        assertThat(throttle.admit(event(Severity.HIGH, 0.1, 10_000L))).isFalse();
        assertThat(throttle.historySize()).isZero();
    }

    @Test
    void confidenceAtFloorIsAdmitted() {
        assertThat(throttle.admit(event(Severity.MEDIUM, 0.3, 10_000L))).isTrue();
    }

    @Test
    void duplicateKeyIsRejected() {
        assertThat(throttle.admit(event(Severity.HIGH, 0.8, 10_000L))).isTrue();
        assertThat(throttle.admit(event(Severity.HIGH, 0.9, 10_000L))).isFalse();
    }

    @Test
    void differentSeverityOrSecondIsADifferentKey() {
        assertThat(throttle.admit(event(Severity.HIGH, 0.8, 10_000L))).isTrue();
        assertThat(throttle.admit(event(Severity.MEDIUM, 0.8, 10_000L))).isTrue();
        assertThat(throttle.admit(event(Severity.HIGH, 0.8, 10_001L))).isTrue();
    }

    @Test
    void criticalAlwaysPassesAndIsRecorded() {
        AnomalyEvent critical = event(Severity.CRITICAL, 0.8, 10_000L);

        assertThat(throttle.admit(critical)).isTrue();
        assertThat(throttle.admit(critical)).isTrue();
        assertThat(throttle.hasRecorded(critical)).isTrue();
        assertThat(throttle.historySize()).isEqualTo(1);
    }

    @Test
    void historyIsBoundedAndEvictsOldestFirst() {
        for (int i = 0; i < AlertThrottle.MAX_HISTORY + 5; i++) {
            clock.advance(Duration.ofSeconds(1));
            assertThat(throttle.admit(event(Severity.HIGH, 0.8, 20_000L + i))).isTrue();
        }

        assertThat(throttle.historySize()).isEqualTo(AlertThrottle.MAX_HISTORY);
        assertThat(throttle.hasRecorded(event(Severity.HIGH, 0.8, 20_000L))).isFalse();
        assertThat(throttle.hasRecorded(event(Severity.HIGH, 0.8, 20_004L))).isFalse();
        assertThat(throttle.hasRecorded(event(Severity.HIGH, 0.8, 20_005L))).isTrue();
        // evicted keys can be admitted again
        assertThat(throttle.admit(event(Severity.HIGH, 0.8, 20_000L))).isTrue();
    }

    @Test
    void keyCombinesSeverityAndEventSecond() {
        assertThat(AlertThrottle.keyFor(event(Severity.HIGH, 0.8, 1_234L))).isEqualTo("HIGH_1234");
    }
}
