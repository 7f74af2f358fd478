package com.geoinsight.mcp.service;

import com.geoinsight.mcp.exception.InvalidArgumentException;
import com.geoinsight.mcp.model.AnalyticalOperation;
import com.geoinsight.mcp.model.Domain;
import com.geoinsight.mcp.model.Metric;
import com.geoinsight.mcp.model.PeriodRange;
import com.geoinsight.mcp.model.SpatialLevel;
import com.geoinsight.mcp.model.StructuredQuery;

/**
 * Argument checks a structured query must pass before it may be cached: every field its operation
 * reads is parsed the way the operation parses it, and single-region operations name a region.
 */
final class StructuredQueryChecks {

    private StructuredQueryChecks() {
    }

    /**
     * @throws InvalidArgumentException naming the first argument the operation would reject
     */
    static void requireExecutable(StructuredQuery query) {
        AnalyticalOperation operation = AnalyticalOperation.fromValue(query.getOperation())
                .orElse(AnalyticalOperation.COMPARE_DOMAINS);
        SpatialLevel.parse(query.getLevel(), SpatialLevel.INTERMEDIATE);

        switch (operation) {
            case GET_RANKINGS:
                Metric.parse(query.rankingMetric());
                singlePeriod(query);
                break;
            case DETECT_ANOMALY:
                requireRegion(query, operation);
                InsightQueryService.metricOf(query.anomalyTarget());
                singlePeriod(query);
                break;
            case GET_ADVANCED_INSIGHT:
                requireRegion(query, operation);
                Domain.parseAll(query.domainList());
                singlePeriod(query);
                break;
            case COMPARE_DOMAINS:
            default:
                Domain.parseAll(query.domainList());
                PeriodRange.between(query.rangeFrom(), query.rangeTo());
                break;
        }
    }

    private static void singlePeriod(StructuredQuery query) {
        String period = query.singlePeriod();
        if (period != null && !period.isBlank()) {
            PeriodRange.of(period);
        }
    }

    private static void requireRegion(StructuredQuery query, AnalyticalOperation operation) {
        if (query.getRegion() == null || query.getRegion().isBlank()) {
            throw new InvalidArgumentException("region is required for " + operation.getValue());
        }
    }
}
