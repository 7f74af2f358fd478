package com.geoinsight.mcp.service;

import com.geoinsight.mcp.model.ActivityFact;
import com.geoinsight.mcp.model.DemographicDominance;
import com.geoinsight.mcp.model.DemographicFact;
import com.geoinsight.mcp.model.InsightCandidate;
import com.geoinsight.mcp.model.Metric;
import com.geoinsight.mcp.model.MetricWindow;
import com.geoinsight.mcp.model.ResolvedSpatialUnit;
import com.geoinsight.mcp.model.SeriesPoint;
import com.geoinsight.mcp.model.SpatialLevel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Builds the unified candidate collection: one row per (level, spatial label, date).
 *
 * Every level sums the facts to its own labels before the window statistics run, so a coarse
 * unit's z-score is measured against its own history, not rolled up from finer units.
 * Demographic dominance is attached at the finest level only.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class InsightCandidateAggregator {

    private final SpatialResolverService resolverService;
    private final WindowedMetricsEngine metricsEngine;
    private final DemographicDominanceCalculator dominanceCalculator;

    /**
     * All three levels, finest first, each ordered by label then date.
     */
    public List<InsightCandidate> aggregate(FactSnapshot snapshot) {
        Map<String, ResolvedSpatialUnit> resolved = resolveKeys(snapshot);
        List<InsightCandidate> candidates = new ArrayList<>();
        for (SpatialLevel level : SpatialLevel.values()) {
            candidates.addAll(aggregate(snapshot, level, resolved));
        }
        return candidates;
    }

    public List<InsightCandidate> aggregate(FactSnapshot snapshot, SpatialLevel level) {
        return aggregate(snapshot, level, resolveKeys(snapshot));
    }

    private List<InsightCandidate> aggregate(FactSnapshot snapshot, SpatialLevel level,
                                             Map<String, ResolvedSpatialUnit> resolved) {
        List<SeriesPoint> points = sumByLabelAndDate(snapshot.getActivityFacts(), level, resolved);
        List<MetricWindow> footTraffic = metricsEngine.compute(points, Metric.FOOT_TRAFFIC);
        List<MetricWindow> sales = metricsEngine.compute(points, Metric.SALES);

        Map<String, DemographicDominance> dominance = new HashMap<>();
        if (level == SpatialLevel.FINEST) {
            List<DemographicFact> demographics = snapshot.getDemographicFacts();
            for (DemographicDominance d : dominanceCalculator.compute(demographics,
                    key -> resolved.get(key).labelAt(SpatialLevel.FINEST))) {
                dominance.put(cellKey(d.getSpatialLabel(), d.getDate()), d);
            }
        }

        List<InsightCandidate> candidates = new ArrayList<>(points.size());
        for (int i = 0; i < points.size(); i++) {
            SeriesPoint point = points.get(i);
            DemographicDominance d = dominance.get(cellKey(point.getSpatialLabel(), point.getDate()));
            candidates.add(InsightCandidate.builder()
                    .level(level)
                    .spatialLabel(point.getSpatialLabel())
                    .date(point.getDate())
                    .footTraffic(footTraffic.get(i))
                    .sales(sales.get(i))
                    .salesCount(point.getSalesCount())
                    .dominantGroup(d != null ? d.getDominantGroup() : null)
                    .dominantShare(d != null ? d.getDominantShare() : null)
                    .sources(point.getSources())
                    .build());
        }
        log.debug("Aggregated {} candidates at {} level", candidates.size(), level.getValue());
        return candidates;
    }

    private Map<String, ResolvedSpatialUnit> resolveKeys(FactSnapshot snapshot) {
        Set<String> keys = new LinkedHashSet<>();
        snapshot.getActivityFacts().forEach(f -> keys.add(f.getId().getSpatialKey()));
        snapshot.getDemographicFacts().forEach(f -> keys.add(f.getId().getSpatialKey()));
        return resolverService.resolveAll(keys, snapshot.getDirectory());
    }

    private List<SeriesPoint> sumByLabelAndDate(List<ActivityFact> facts, SpatialLevel level,
                                                Map<String, ResolvedSpatialUnit> resolved) {
        Map<String, Map<LocalDate, SeriesPoint>> cells = new TreeMap<>();
        Map<SeriesPoint, Set<String>> sourcesByCell = new IdentityHashMap<>();
        for (ActivityFact fact : facts) {
            ActivityFact.Id id = fact.getId();
            String label = resolved.get(id.getSpatialKey()).labelAt(level);
            SeriesPoint point = cells.computeIfAbsent(label, k -> new TreeMap<>())
                    .computeIfAbsent(id.getDate(), date -> SeriesPoint.builder()
                            .spatialLabel(label)
                            .date(date)
                            .build());
            point.setFootTraffic(add(point.getFootTraffic(), fact.getFootTraffic()));
            point.setSales(add(point.getSales(), fact.getSales()));
            point.setSalesCount(add(point.getSalesCount(), fact.getSalesCount()));
            sourcesByCell.computeIfAbsent(point, p -> new TreeSet<>()).add(id.getSource());
        }

        List<SeriesPoint> points = new ArrayList<>();
        cells.values().forEach(byDate -> points.addAll(byDate.values()));
        for (SeriesPoint point : points) {
            point.setSources(new ArrayList<>(sourcesByCell.get(point)));
        }
        return points;
    }

    /** Sum of the present operands; null only when both are absent. */
    private static Double add(Double total, Double value) {
        if (value == null) {
            return total;
        }
        return total == null ? value : total + value;
    }

    private static String cellKey(String label, LocalDate date) {
        return label + "\u0000" + date;
    }
}
