package com.geoinsight.mcp.service;

import com.geoinsight.mcp.model.AnalyticalOperation;
import com.geoinsight.mcp.model.AskResponse;
import com.geoinsight.mcp.model.CacheResolution;
import com.geoinsight.mcp.model.StructuredQuery;
import com.geoinsight.mcp.model.ToolResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Free-text entry point: resolve the request through the semantic cache, then dispatch the
 * structured query to its operation. A query without an operation, including the empty default
 * served when translation fails, runs a region-less domain comparison.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AnalyticalRequestService {

    private final SemanticQueryCacheService queryCache;
    private final InsightQueryService insightQueryService;

    public AskResponse ask(String question) {
        long start = System.currentTimeMillis();
        CacheResolution resolution = queryCache.resolve(question);
        StructuredQuery query = resolution.getStructuredQuery() != null
                ? resolution.getStructuredQuery() : StructuredQuery.empty();

        AnalyticalOperation operation = AnalyticalOperation.fromValue(query.getOperation())
                .orElse(AnalyticalOperation.COMPARE_DOMAINS);
        log.info("🔵 Dispatching {} (cache: {})", operation.getValue(), resolution.getOutcome().getValue());

        ToolResponse<?> result = dispatch(operation, query);
        if (resolution.isFallback()) {
            List<String> warnings = new ArrayList<>(result.getMetadata().getWarnings());
            warnings.add("request could not be translated; default scope applied");
            result.getMetadata().setWarnings(warnings);
        }

        log.info("✅ Answered {} in {}ms", operation.getValue(), System.currentTimeMillis() - start);
        return AskResponse.builder()
                .question(question)
                .operation(operation.getValue())
                .resolution(resolution)
                .result(result)
                .build();
    }

    private ToolResponse<?> dispatch(AnalyticalOperation operation, StructuredQuery query) {
        switch (operation) {
            case GET_RANKINGS:
                return insightQueryService.getRankings(
                        query.rankingMetric(), query.singlePeriod(), query.getTopK(), query.getLevel());
            case DETECT_ANOMALY:
                return insightQueryService.detectAnomaly(
                        query.getRegion(), query.anomalyTarget(),
                        query.singlePeriod(), query.getAnomalyThreshold(), query.getLevel());
            case GET_ADVANCED_INSIGHT:
                return insightQueryService.getAdvancedInsight(
                        query.getRegion(), query.singlePeriod(), query.domainList(), query.getLevel());
            case COMPARE_DOMAINS:
            default:
                return insightQueryService.compareDomains(query.getRegion(), query.rangeFrom(), query.rangeTo(),
                        query.domainList(), query.getLevel());
        }
    }
}
