package com.geoinsight.mcp.controller;

import com.geoinsight.mcp.model.CacheStats;
import com.geoinsight.mcp.service.CacheMetricsService;
import com.geoinsight.mcp.service.SemanticQueryCacheService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/mcp/cache")
@CrossOrigin(origins = "*")
@RequiredArgsConstructor
public class CacheMonitoringController {

    private final CacheMetricsService metricsService;
    private final SemanticQueryCacheService queryCache;

    /**
     * Hit/miss counters since startup plus the current index size
     */
    @GetMapping("/stats")
    public ResponseEntity<CacheStats> getStats() {
        return ResponseEntity.ok(metricsService.getStats(queryCache.indexSize()));
    }
}
