package com.geoinsight.mcp.service;

import com.geoinsight.mcp.exception.InternalInvariantException;
import com.geoinsight.mcp.model.Metric;
import com.geoinsight.mcp.model.MetricWindow;
import com.geoinsight.mcp.model.SeriesPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static com.geoinsight.mcp.support.Facts.month;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("WindowedMetricsEngine")
class WindowedMetricsEngineTest {

    private final WindowedMetricsEngine engine = new WindowedMetricsEngine();

    private static SeriesPoint point(String label, LocalDate date, Double footTraffic) {
        return SeriesPoint.builder().spatialLabel(label).date(date).footTraffic(footTraffic).build();
    }

    @Test
    @DisplayName("Month-over-month and year-over-year use lag 1 and lag 12 rows")
    void momAndYoy() {
        List<SeriesPoint> points = new ArrayList<>();
        for (int i = 0; i < 13; i++) {
            points.add(point("A", month(2023, 1).plusMonths(i), 100.0 + 10 * i));
        }

        List<MetricWindow> windows = engine.compute(points, Metric.FOOT_TRAFFIC);

        MetricWindow last = windows.get(12);  // 2024-01 = 220
        assertThat(last.getPrevious()).isEqualTo(210.0);
        assertThat(last.getMomPct()).isCloseTo((220.0 - 210.0) / 210.0, within(1e-12));
        assertThat(last.getPreviousYear()).isEqualTo(100.0);
        assertThat(last.getYoyPct()).isCloseTo(1.2, within(1e-12));

        MetricWindow first = windows.get(0);
        assertThat(first.getPrevious()).isNull();
        assertThat(first.getMomPct()).isNull();
        assertThat(windows.get(11).getYoyPct()).isNull();
    }

    @Test
    @DisplayName("Lag follows rows, not calendar months, when months are missing")
    void lagIsRowBased() {
        List<MetricWindow> windows = engine.compute(List.of(
                point("A", month(2024, 3), 150.0),
                point("A", month(2024, 1), 100.0)), Metric.FOOT_TRAFFIC);

        assertThat(windows.get(0).getPrevious()).isEqualTo(100.0);
        assertThat(windows.get(0).getMomPct()).isCloseTo(0.5, within(1e-12));
    }

    @Test
    @DisplayName("Relative change is empty when the prior value is zero or absent")
    void relativeChangeUndefinedForZeroOrAbsentPrior() {
        List<MetricWindow> windows = engine.compute(List.of(
                point("A", month(2024, 1), 0.0),
                point("A", month(2024, 2), 50.0),
                point("A", month(2024, 3), null),
                point("A", month(2024, 4), 80.0)), Metric.FOOT_TRAFFIC);

        assertThat(windows.get(1).getMomPct()).isNull();
        assertThat(windows.get(2).getMomPct()).isNull();
        assertThat(windows.get(3).getPrevious()).isNull();
        assertThat(windows.get(3).getMomPct()).isNull();
    }

    @Test
    @DisplayName("Fewer than two observations leave std and z-score empty, never zero or NaN")
    void singleObservationHasNoStd() {
        List<MetricWindow> windows = engine.compute(List.of(
                point("A", month(2024, 1), 42.0),
                point("A", month(2024, 2), null)), Metric.FOOT_TRAFFIC);

        assertThat(windows.get(0).getSeriesMean()).isEqualTo(42.0);
        assertThat(windows.get(0).getSeriesStd()).isNull();
        assertThat(windows.get(0).getZscore()).isNull();
        assertThat(windows.get(1).getZscore()).isNull();
    }

    @Test
    @DisplayName("A constant series has zero std and an empty z-score")
    void constantSeriesHasNoZscore() {
        List<MetricWindow> windows = engine.compute(List.of(
                point("A", month(2024, 1), 5.0),
                point("A", month(2024, 2), 5.0)), Metric.FOOT_TRAFFIC);

        assertThat(windows.get(0).getSeriesStd()).isEqualTo(0.0);
        assertThat(windows.get(0).getZscore()).isNull();
    }

    @Test
    @DisplayName("Z-score uses the sample standard deviation of the whole series")
    void zscoreUsesSampleStd() {
        List<MetricWindow> windows = engine.compute(List.of(
                point("A", month(2024, 1), 2.0),
                point("A", month(2024, 2), 4.0),
                point("A", month(2024, 3), 6.0)), Metric.FOOT_TRAFFIC);

        assertThat(windows.get(2).getSeriesMean()).isEqualTo(4.0);
        assertThat(windows.get(2).getSeriesStd()).isCloseTo(2.0, within(1e-12));
        assertThat(windows.get(2).getZscore()).isCloseTo(1.0, within(1e-12));
    }

    @Test
    @DisplayName("Rank is dense and descending per date; empty values have no rank")
    void denseRankWithEmptyValuesLast() {
        LocalDate date = month(2024, 1);
        List<MetricWindow> windows = engine.compute(List.of(
                point("A", date, 10.0),
                point("B", date, 20.0),
                point("C", date, 20.0),
                point("D", date, null),
                point("E", month(2024, 2), 1.0)), Metric.FOOT_TRAFFIC);

        assertThat(windows.get(1).getRank()).isEqualTo(1);
        assertThat(windows.get(2).getRank()).isEqualTo(1);
        assertThat(windows.get(0).getRank()).isEqualTo(2);
        assertThat(windows.get(3).getRank()).isNull();
        assertThat(windows.get(4).getRank()).isEqualTo(1);
        assertThat(windows.get(0).getDateMean()).isCloseTo(50.0 / 3, within(1e-12));
        assertThat(windows.get(4).getDateMean()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Each metric is windowed independently")
    void metricsAreIndependent() {
        List<SeriesPoint> points = List.of(
                SeriesPoint.builder().spatialLabel("A").date(month(2024, 1)).footTraffic(1.0).sales(300.0).build(),
                SeriesPoint.builder().spatialLabel("B").date(month(2024, 1)).footTraffic(2.0).sales(100.0).build());

        assertThat(engine.compute(points, Metric.FOOT_TRAFFIC).get(1).getRank()).isEqualTo(1);
        assertThat(engine.compute(points, Metric.SALES).get(0).getRank()).isEqualTo(1);
    }

    @Test
    @DisplayName("Two rows for one (label, date) are an invariant violation")
    void duplicateCellRejected() {
        List<SeriesPoint> points = List.of(
                point("A", month(2024, 1), 1.0),
                point("A", month(2024, 1), 2.0));

        assertThatThrownBy(() -> engine.compute(points, Metric.FOOT_TRAFFIC))
                .isInstanceOf(InternalInvariantException.class);
    }
}
