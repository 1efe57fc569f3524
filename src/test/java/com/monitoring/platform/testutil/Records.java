package com.monitoring.platform.testutil;

import com.monitoring.platform.domain.TimedRecord;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shorthand for building telemetry records in tests.
 */
public final class Records {

    private Records() {
    }

    /** Infrastructure-side record keyed on lastclock. */
    public static TimedRecord seriesA(long lastclock, Object lastvalue) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("itemid", "10001");
        row.put("lastclock", lastclock);
        row.put("lastvalue", lastvalue);
        return TimedRecord.fromRow(row, "lastclock");
    }

    /** Application-side record keyed on timestamp. */
    public static TimedRecord seriesB(long timestamp, Object errorRate) {
        return seriesB(timestamp, errorRate, null);
    }

    public static TimedRecord seriesB(long timestamp, Object errorRate, Object responseTimeMs) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", timestamp);
        row.put("error_rate", errorRate);
        row.put("response_time_ms", responseTimeMs);
        return TimedRecord.fromRow(row, "timestamp");
    }
}
