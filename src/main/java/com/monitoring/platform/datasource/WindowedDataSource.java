package com.monitoring.platform.datasource;

import com.monitoring.platform.domain.SeriesWindow;

/**
 * Source of the two telemetry series for a look-back window. Implementations never throw:
 * a failed fetch is reported as {@link SeriesWindow#unavailable(String)}.
 */
public interface WindowedDataSource {

    SeriesWindow fetch(int windowMinutes);
}
