package com.geoinsight.mcp.service;

import com.geoinsight.mcp.model.CacheOutcome;
import com.geoinsight.mcp.model.CacheStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process counters for the semantic query cache. Reset on restart.
 */
@Service
@Slf4j
public class CacheMetricsService {

    private final AtomicLong exactHits = new AtomicLong(0);
    private final AtomicLong nearHits = new AtomicLong(0);
    private final AtomicLong misses = new AtomicLong(0);
    private final AtomicLong fallbacks = new AtomicLong(0);
    private final AtomicLong translatorFailures = new AtomicLong(0);
    private final AtomicLong embeddingFailures = new AtomicLong(0);
    private final AtomicLong aliasesWritten = new AtomicLong(0);

    /**
     * Record how a request was resolved
     */
    public void recordOutcome(CacheOutcome outcome) {
        switch (outcome) {
            case EXACT_HIT:
                exactHits.incrementAndGet();
                break;
            case NEAR_HIT:
                nearHits.incrementAndGet();
                break;
            case MISS:
                misses.incrementAndGet();
                break;
            case MISS_FALLBACK:
                misses.incrementAndGet();
                fallbacks.incrementAndGet();
                break;
            default:
                log.warn("Unknown cache outcome {}", outcome);
        }
    }

    public void recordTranslatorFailure() {
        translatorFailures.incrementAndGet();
    }

    public void recordEmbeddingFailure() {
        embeddingFailures.incrementAndGet();
    }

    public void recordAliasWritten() {
        aliasesWritten.incrementAndGet();
    }

    public CacheStats getStats(int indexSize) {
        long hits = exactHits.get() + nearHits.get();
        long total = hits + misses.get();

        CacheStats stats = new CacheStats();
        stats.setExactHits(exactHits.get());
        stats.setNearHits(nearHits.get());
        stats.setMisses(misses.get());
        stats.setFallbacks(fallbacks.get());
        stats.setTranslatorFailures(translatorFailures.get());
        stats.setEmbeddingFailures(embeddingFailures.get());
        stats.setAliasesWritten(aliasesWritten.get());
        stats.setHitRate(total > 0 ? (double) hits / total : 0.0);
        stats.setIndexSize(indexSize);
        return stats;
    }
}
