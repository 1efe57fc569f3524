package com.monitoring.platform.datasource;

import com.monitoring.platform.domain.SeriesWindow;
import com.monitoring.platform.domain.TimedRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reads the infrastructure series (Zabbix items) and the application series (HyphenMon metrics)
 * stored by the collectors in MySQL.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JdbcWindowedDataSource implements WindowedDataSource {

    static final String SERIES_A_TIMESTAMP_FIELD = "lastclock";
    static final String SERIES_B_TIMESTAMP_FIELD = "timestamp";

    static final String SERIES_A_QUERY =
            "SELECT itemid, name, lastvalue, lastclock, hostid, recorded_at FROM zabbix_items "
                    + "WHERE recorded_at >= NOW() - INTERVAL ? MINUTE ORDER BY lastclock DESC";
    static final String SERIES_B_QUERY =
            "SELECT timestamp, response_time_ms, error_rate, recorded_at FROM hyphenmon_metrics "
                    + "WHERE recorded_at >= NOW() - INTERVAL ? MINUTE ORDER BY timestamp DESC";

    private final JdbcTemplate jdbcTemplate;

    @Override
    public SeriesWindow fetch(int windowMinutes) {
        try {
            List<TimedRecord> seriesA = query(SERIES_A_QUERY, SERIES_A_TIMESTAMP_FIELD, windowMinutes);
            List<TimedRecord> seriesB = query(SERIES_B_QUERY, SERIES_B_TIMESTAMP_FIELD, windowMinutes);
            log.info("Fetched telemetry window: windowMinutes={} seriesA={} seriesB={}",
                    windowMinutes, seriesA.size(), seriesB.size());
            return SeriesWindow.of(seriesA, seriesB);
        } catch (DataAccessException e) {
            log.error("Telemetry fetch failed for windowMinutes={}", windowMinutes, e);
            return SeriesWindow.unavailable("Data source unavailable: " + e.getMostSpecificCause().getMessage());
        }
    }

    private List<TimedRecord> query(String sql, String timestampField, int windowMinutes) {
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(sql, windowMinutes);
        return rows.stream()
                .map(row -> TimedRecord.fromRow(row, timestampField))
                .collect(Collectors.toList());
    }
}
