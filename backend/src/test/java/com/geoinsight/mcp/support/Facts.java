package com.geoinsight.mcp.support;

import com.geoinsight.mcp.config.AdminCodeDirectoryLoader;
import com.geoinsight.mcp.model.ActivityFact;
import com.geoinsight.mcp.model.AdminDistrict;
import com.geoinsight.mcp.model.DemographicFact;
import com.geoinsight.mcp.model.SpatialDimension;
import com.geoinsight.mcp.service.DemographicDominanceCalculator;
import com.geoinsight.mcp.service.FactSnapshotService;
import com.geoinsight.mcp.service.FactStore;
import com.geoinsight.mcp.service.InsightCandidateAggregator;
import com.geoinsight.mcp.service.SpatialResolverService;
import com.geoinsight.mcp.service.WindowedMetricsEngine;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Fixture builders for facts and directories, plus the analytics pipeline wired without Spring.
 */
public final class Facts {

    public static final String MONTH = "month";

    private Facts() {
    }

    public static LocalDate month(int year, int month) {
        return LocalDate.of(year, month, 1);
    }

    public static ActivityFact activity(String key, LocalDate date, String source,
                                        Double footTraffic, Double sales) {
        return ActivityFact.builder()
                .id(new ActivityFact.Id(key, date, MONTH, source))
                .footTraffic(footTraffic)
                .sales(sales)
                .build();
    }

    public static ActivityFact footTraffic(String key, LocalDate date, double value) {
        return activity(key, date, "telco", value, null);
    }

    /** One foot-traffic row per month starting at {@code first}. */
    public static List<ActivityFact> monthlyFootTraffic(String key, LocalDate first, double... values) {
        List<ActivityFact> facts = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            facts.add(footTraffic(key, first.plusMonths(i), values[i]));
        }
        return facts;
    }

    public static DemographicFact demographic(String key, LocalDate date, String sex, String ageGroup, Double value) {
        return DemographicFact.builder()
                .id(new DemographicFact.Id(key, date, MONTH, "telco", sex, ageGroup))
                .value(value)
                .build();
    }

    public static SpatialDimension dimension(String key, String label, String code) {
        return SpatialDimension.builder()
                .spatialKey(key)
                .spatialLabel(label)
                .spatialType("emd")
                .code(code)
                .build();
    }

    public static AdminDistrict district(String sigCode, String sigName, String sidoName) {
        return AdminDistrict.builder()
                .sigCode(sigCode)
                .sigName(sigName)
                .sidoCode(sigCode.substring(0, 2))
                .sidoName(sidoName)
                .build();
    }

    public static AdminCodeDirectoryLoader provinceCodes() {
        AdminCodeDirectoryLoader loader = new AdminCodeDirectoryLoader();
        loader.load();
        return loader;
    }

    public static FactSnapshotService snapshotService(FactStore store) {
        return new FactSnapshotService(store, provinceCodes());
    }

    public static InsightCandidateAggregator aggregator() {
        return new InsightCandidateAggregator(new SpatialResolverService(),
                new WindowedMetricsEngine(), new DemographicDominanceCalculator());
    }
}
