package com.geoinsight.mcp.controller;

import com.geoinsight.mcp.model.AdvancedInsightResult;
import com.geoinsight.mcp.model.AdvancedInsightSnapshot;
import com.geoinsight.mcp.model.AnomalyResult;
import com.geoinsight.mcp.model.AskRequest;
import com.geoinsight.mcp.model.AskResponse;
import com.geoinsight.mcp.model.CompareDomainsResult;
import com.geoinsight.mcp.model.RankingsResult;
import com.geoinsight.mcp.model.ToolResponse;
import com.geoinsight.mcp.service.AdvancedInsightService;
import com.geoinsight.mcp.service.AnalyticalRequestService;
import com.geoinsight.mcp.service.InsightQueryService;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Thin HTTP surface over the analytical operations, used by the tool-calling layer.
 */
@RestController
@RequestMapping("/mcp")
@CrossOrigin(origins = "*")
@Slf4j
public class InsightToolController {

    private final InsightQueryService insightQueryService;
    private final AdvancedInsightService advancedInsightService;
    private final AnalyticalRequestService analyticalRequestService;

    public InsightToolController(InsightQueryService insightQueryService,
                                 AdvancedInsightService advancedInsightService,
                                 AnalyticalRequestService analyticalRequestService) {
        this.insightQueryService = insightQueryService;
        this.advancedInsightService = advancedInsightService;
        this.analyticalRequestService = analyticalRequestService;
    }

    @GetMapping("/tools/compare-domains")
    public ResponseEntity<ToolResponse<CompareDomainsResult>> compareDomains(
            @RequestParam(required = false) String region,
            @RequestParam(name = "period_from", required = false) String periodFrom,
            @RequestParam(name = "period_to", required = false) String periodTo,
            @RequestParam(required = false) List<String> domains,
            @RequestParam(required = false) String level) {
        log.info("🔵 compare-domains region={} period={}..{} domains={} level={}",
                region, periodFrom, periodTo, domains, level);
        return ResponseEntity.ok(insightQueryService.compareDomains(region, periodFrom, periodTo, domains, level));
    }

    @GetMapping("/tools/rankings")
    public ResponseEntity<ToolResponse<RankingsResult>> getRankings(
            @RequestParam String metric,
            @RequestParam(required = false) String period,
            @RequestParam(name = "top_k", required = false) Integer topK,
            @RequestParam(required = false) String level) {
        log.info("🔵 rankings metric={} period={} top_k={} level={}", metric, period, topK, level);
        return ResponseEntity.ok(insightQueryService.getRankings(metric, period, topK, level));
    }

    @GetMapping("/tools/anomaly")
    public ResponseEntity<ToolResponse<AnomalyResult>> detectAnomaly(
            @RequestParam String region,
            @RequestParam(required = false) String domain,
            @RequestParam(required = false) String period,
            @RequestParam(name = "z_threshold", required = false) Double zThreshold,
            @RequestParam(required = false) String level) {
        log.info("🔵 anomaly region={} domain={} period={} z_threshold={} level={}",
                region, domain, period, zThreshold, level);
        return ResponseEntity.ok(insightQueryService.detectAnomaly(region, domain, period, zThreshold, level));
    }

    @GetMapping("/tools/advanced-insight")
    public ResponseEntity<ToolResponse<AdvancedInsightResult>> getAdvancedInsight(
            @RequestParam String region,
            @RequestParam(required = false) String period,
            @RequestParam(required = false) List<String> domains,
            @RequestParam(required = false) String level) {
        return ResponseEntity.ok(insightQueryService.getAdvancedInsight(region, period, domains, level));
    }

    @PostMapping("/tools/advanced-insight/refresh")
    public ResponseEntity<Map<String, Object>> refreshAdvancedInsight() {
        log.info("🔄 On-demand advanced insight refresh requested");
        AdvancedInsightSnapshot snapshot = advancedInsightService.refresh();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "refreshed");
        body.put("units", snapshot.size());
        body.put("last_refreshed_at", snapshot.getRefreshedAt());
        body.put("requested_at", Instant.now());
        return ResponseEntity.ok(body);
    }

    @PostMapping("/ask")
    public ResponseEntity<AskResponse> ask(@Valid @RequestBody AskRequest request) {
        String requestId = UUID.randomUUID().toString().substring(0, 8);
        log.info("🔵 [REQUEST-{}] Question: '{}'", requestId,
                request.getQuestion().substring(0, Math.min(80, request.getQuestion().length())));
        AskResponse response = analyticalRequestService.ask(request.getQuestion());
        log.info("✅ [REQUEST-{}] {} via {}", requestId, response.getOperation(),
                response.getResolution().getOutcome().getValue());
        return ResponseEntity.ok(response);
    }
}
