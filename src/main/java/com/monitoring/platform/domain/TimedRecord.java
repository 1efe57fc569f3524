package com.monitoring.platform.domain;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One row from either telemetry series: an epoch-seconds timestamp plus the raw field values.
 * Records without a usable timestamp cannot be aligned and are skipped by correlation.
 */
@Value
public class TimedRecord {

    /** Epoch seconds; null when the source row had no usable timestamp. */
    Long timestamp;
    Map<String, Object> fields;

    public TimedRecord(Long timestamp, Map<String, Object> fields) {
        this.timestamp = timestamp;
        this.fields = fields == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * Builds a record from a raw row, reading the timestamp from {@code timestampField}.
     * Numbers and numeric strings are accepted; zero, negative or unparseable values count as absent
     * (the infrastructure feed reports 0 for items that were never polled).
     */
    public static TimedRecord fromRow(Map<String, Object> row, String timestampField) {
        Object raw = row != null ? row.get(timestampField) : null;
        return new TimedRecord(parseTimestamp(raw), row);
    }

    public boolean hasTimestamp() {
        return timestamp != null;
    }

    public Optional<Object> get(String field) {
        return Optional.ofNullable(fields.get(field));
    }

    /**
     * A field counts as populated when it is present and not zero/blank.
     */
    public boolean isPopulated(String field) {
        Object value = fields.get(field);
        if (value == null) return false;
        if (value instanceof Number) return ((Number) value).doubleValue() != 0.0;
        if (value instanceof CharSequence) return !value.toString().isBlank();
        if (value instanceof Boolean) return (Boolean) value;
        return true;
    }

    private static Long parseTimestamp(Object raw) {
        long value;
        if (raw instanceof Number) {
            value = ((Number) raw).longValue();
        } else if (raw instanceof CharSequence) {
            try {
                value = (long) Double.parseDouble(raw.toString().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        } else if (raw instanceof java.util.Date) {
            value = ((java.util.Date) raw).getTime() / 1000L;
        } else if (raw instanceof java.time.LocalDateTime) {
            value = ((java.time.LocalDateTime) raw).atZone(java.time.ZoneOffset.UTC).toEpochSecond();
        } else {
            return null;
        }
        return value > 0 ? value : null;
    }
}
