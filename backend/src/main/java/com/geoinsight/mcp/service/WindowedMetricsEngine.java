package com.geoinsight.mcp.service;

import com.geoinsight.mcp.exception.InternalInvariantException;
import com.geoinsight.mcp.model.Metric;
import com.geoinsight.mcp.model.MetricWindow;
import com.geoinsight.mcp.model.SeriesPoint;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Per-series window statistics over points already summed to one row per (label, date).
 *
 * Partitioned by spatial label and ordered by date, like a SQL window: the previous value is the
 * preceding row (lag 1) and the previous-year value is twelve rows back (lag 12), whether or not
 * the months in between exist. Series statistics cover the label's whole history; the date mean
 * and the dense rank are cross-sectional over all labels sharing the date.
 */
@Component
public class WindowedMetricsEngine {

    private static final int YEAR_LAG = 12;

    /**
     * @return one window per input point, in input order
     */
    public List<MetricWindow> compute(List<SeriesPoint> points, Metric metric) {
        checkUnique(points);

        MetricWindow[] windows = new MetricWindow[points.size()];
        Map<String, List<Integer>> byLabel = new HashMap<>();
        Map<LocalDate, List<Integer>> byDate = new HashMap<>();
        for (int i = 0; i < points.size(); i++) {
            SeriesPoint point = points.get(i);
            byLabel.computeIfAbsent(point.getSpatialLabel(), k -> new ArrayList<>()).add(i);
            byDate.computeIfAbsent(point.getDate(), k -> new ArrayList<>()).add(i);
        }

        for (List<Integer> series : byLabel.values()) {
            series.sort(Comparator.comparing(i -> points.get(i).getDate()));
            List<Double> values = new ArrayList<>(series.size());
            for (Integer i : series) {
                values.add(points.get(i).valueOf(metric));
            }
            Double mean = SeriesStatistics.mean(values);
            Double std = SeriesStatistics.sampleStd(values);

            for (int pos = 0; pos < series.size(); pos++) {
                Double value = values.get(pos);
                Double previous = pos >= 1 ? values.get(pos - 1) : null;
                Double previousYear = pos >= YEAR_LAG ? values.get(pos - YEAR_LAG) : null;
                windows[series.get(pos)] = MetricWindow.builder()
                        .value(value)
                        .previous(previous)
                        .momPct(SeriesStatistics.relativeChange(value, previous))
                        .previousYear(previousYear)
                        .yoyPct(SeriesStatistics.relativeChange(value, previousYear))
                        .seriesMean(mean)
                        .seriesStd(std)
                        .zscore(SeriesStatistics.zscore(value, mean, std))
                        .build();
            }
        }

        for (List<Integer> crossSection : byDate.values()) {
            List<Double> values = new ArrayList<>(crossSection.size());
            TreeSet<Double> distinct = new TreeSet<>(Comparator.reverseOrder());
            for (Integer i : crossSection) {
                Double value = points.get(i).valueOf(metric);
                values.add(value);
                if (value != null) {
                    distinct.add(value);
                }
            }
            Double dateMean = SeriesStatistics.mean(values);
            Map<Double, Integer> denseRank = new HashMap<>();
            int rank = 1;
            for (Double value : distinct) {
                denseRank.put(value, rank++);
            }
            for (Integer i : crossSection) {
                MetricWindow window = windows[i];
                window.setDateMean(dateMean);
                window.setRank(window.getValue() != null ? denseRank.get(window.getValue()) : null);
            }
        }

        List<MetricWindow> result = new ArrayList<>(windows.length);
        for (MetricWindow window : windows) {
            result.add(window);
        }
        return result;
    }

    private void checkUnique(List<SeriesPoint> points) {
        Set<String> seen = new HashSet<>();
        for (SeriesPoint point : points) {
            if (!seen.add(point.getSpatialLabel() + "\u0000" + point.getDate())) {
                throw new InternalInvariantException("two series rows for (" + point.getSpatialLabel()
                        + ", " + point.getDate() + ")");
            }
        }
    }
}
