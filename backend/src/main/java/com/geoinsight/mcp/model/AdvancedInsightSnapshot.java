package com.geoinsight.mcp.model;

import com.geoinsight.mcp.service.spatial.SpatialDirectory;
import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable result set of one advanced-insight refresh. Swapped atomically as a whole, together
 * with the spatial directory the refresh labelled its units from.
 */
@Getter
public class AdvancedInsightSnapshot {

    private final Instant refreshedAt;
    private final Map<String, AdvancedInsight> insights;
    private final List<String> sources;
    private final List<String> warnings;
    private final SpatialDirectory directory;

    public AdvancedInsightSnapshot(Instant refreshedAt, List<AdvancedInsight> insights,
                                   List<String> sources, List<String> warnings) {
        this(refreshedAt, insights, sources, warnings, SpatialDirectory.empty());
    }

    public AdvancedInsightSnapshot(Instant refreshedAt, List<AdvancedInsight> insights,
                                   List<String> sources, List<String> warnings, SpatialDirectory directory) {
        this.refreshedAt = refreshedAt;
        this.directory = directory;
        Map<String, AdvancedInsight> byKey = new LinkedHashMap<>();
        for (AdvancedInsight insight : insights) {
            byKey.put(key(insight.getLevel(), insight.getSpatialLabel()), insight);
        }
        this.insights = Collections.unmodifiableMap(byKey);
        this.sources = List.copyOf(sources);
        this.warnings = List.copyOf(warnings);
    }

    /** Never refreshed yet. */
    public static AdvancedInsightSnapshot empty() {
        return new AdvancedInsightSnapshot(null, List.of(), List.of(), List.of());
    }

    public boolean isEmpty() {
        return refreshedAt == null;
    }

    public Optional<AdvancedInsight> find(SpatialLevel level, String spatialLabel) {
        return Optional.ofNullable(insights.get(key(level, spatialLabel)));
    }

    public int size() {
        return insights.size();
    }

    private static String key(SpatialLevel level, String spatialLabel) {
        return level.getValue() + "|" + spatialLabel;
    }
}
