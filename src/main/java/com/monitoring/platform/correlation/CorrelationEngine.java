package com.monitoring.platform.correlation;

import com.monitoring.platform.domain.CorrelatedPair;
import com.monitoring.platform.domain.TimedRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Aligns the two telemetry series: every Series B record is paired with every Series A record
 * whose timestamp is within {@code windowSeconds} of it. One B record may produce zero, one or many
 * pairs; records without a timestamp are skipped.
 * <p>
 * Series A is sorted once and the window is located by binary search, so the cost is
 * O((|A| + |B|) log |A| + pairs) instead of a full nested scan. The output set is the same.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CorrelationEngine {

    private final Clock clock;

    public List<CorrelatedPair> correlate(List<TimedRecord> seriesA, List<TimedRecord> seriesB, long windowSeconds) {
        if (windowSeconds < 0) {
            throw new IllegalArgumentException("windowSeconds must be >= 0, was " + windowSeconds);
        }
        List<TimedRecord> sortedA = new ArrayList<>(seriesA.size());
        for (TimedRecord a : seriesA) {
            if (a.hasTimestamp()) sortedA.add(a);
        }
        sortedA.sort(Comparator.comparingLong(TimedRecord::getTimestamp));

        log.debug("Correlating seriesA={} (timestamped={}) seriesB={} window={}s",
                seriesA.size(), sortedA.size(), seriesB.size(), windowSeconds);

        List<CorrelatedPair> pairs = new ArrayList<>();
        for (TimedRecord b : seriesB) {
            if (!b.hasTimestamp()) {
                continue;
            }
            long bTs = b.getTimestamp();
            Instant matchedAt = clock.instant();
            long from = bTs > windowSeconds ? bTs - windowSeconds : 0L;
            for (int i = lowerBound(sortedA, from); i < sortedA.size(); i++) {
                TimedRecord a = sortedA.get(i);
                // timestamps are positive, so the difference cannot overflow
                if (a.getTimestamp() - bTs > windowSeconds) break;
                pairs.add(CorrelatedPair.builder()
                        .seriesARecord(a)
                        .seriesBRecord(b)
                        .correlationTimestamp(matchedAt)
                        .windowSeconds(windowSeconds)
                        .build());
            }
        }
        log.debug("Correlation produced {} pairs", pairs.size());
        return pairs;
    }

    /** First index whose timestamp is >= from. */
    private static int lowerBound(List<TimedRecord> sorted, long from) {
        int lo = 0;
        int hi = sorted.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (sorted.get(mid).getTimestamp() < from) lo = mid + 1;
            else hi = mid;
        }
        return lo;
    }
}
