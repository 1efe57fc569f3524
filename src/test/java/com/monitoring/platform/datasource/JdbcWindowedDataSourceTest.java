package com.monitoring.platform.datasource;

import com.monitoring.platform.domain.SeriesWindow;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JdbcWindowedDataSourceTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    @InjectMocks
    private JdbcWindowedDataSource dataSource;

    @Test
    void mapsRowsOfBothSeries() {
        when(jdbcTemplate.queryForList(eq(JdbcWindowedDataSource.SERIES_A_QUERY), eq(5)))
                .thenReturn(List.of(Map.of("itemid", "1", "lastvalue", "42", "lastclock", 1005L)));
        when(jdbcTemplate.queryForList(eq(JdbcWindowedDataSource.SERIES_B_QUERY), eq(5)))
                .thenReturn(List.of(
                        Map.of("timestamp", 1000.0, "error_rate", 0.9),
                        Map.of("timestamp", 1001.0, "error_rate", 0.1)));

        SeriesWindow window = dataSource.fetch(5);

        assertThat(window.isAvailable()).isTrue();
        assertThat(window.getSeriesA()).hasSize(1);
        assertThat(window.getSeriesA().get(0).getTimestamp()).isEqualTo(1005L);
        assertThat(window.getSeriesB()).extracting(r -> r.getTimestamp()).containsExactly(1000L, 1001L);
        assertThat(window.getSeriesB().get(0).getFields()).containsEntry("error_rate", 0.9);
    }

    @Test
    void databaseFailureYieldsUnavailableEmptyWindow() {
        when(jdbcTemplate.queryForList(eq(JdbcWindowedDataSource.SERIES_A_QUERY), eq(5)))
                .thenThrow(new DataAccessResourceFailureException("Communications link failure"));

        SeriesWindow window = dataSource.fetch(5);

        assertThat(window.isAvailable()).isFalse();
        assertThat(window.getUnavailableReason()).contains("Communications link failure");
        assertThat(window.getSeriesA()).isEmpty();
        assertThat(window.getSeriesB()).isEmpty();
    }
}
