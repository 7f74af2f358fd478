package com.geoinsight.mcp.service;

import com.geoinsight.mcp.exception.InsightException;
import com.geoinsight.mcp.exception.UpstreamUnavailableException;
import com.geoinsight.mcp.model.AdvancedInsight;
import com.geoinsight.mcp.model.AdvancedInsightSnapshot;
import com.geoinsight.mcp.model.InsightCandidate;
import com.geoinsight.mcp.model.Metric;
import com.geoinsight.mcp.model.SpatialLevel;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Batch correlation and impact scores per (level, spatial label), recomputed only on refresh.
 *
 * Refreshes are serialized by a lock and run on a dedicated thread with a deadline. A finished
 * refresh replaces the whole result set in one reference swap, so readers see either the old or
 * the new set. A failed or timed-out refresh leaves the last good set in place.
 */
@Service
@Slf4j
public class AdvancedInsightService {

    private final FactSnapshotService factSnapshotService;
    private final InsightCandidateAggregator aggregator;
    private final long refreshTimeoutMs;

    private final AtomicReference<AdvancedInsightSnapshot> current =
            new AtomicReference<>(AdvancedInsightSnapshot.empty());
    private final ReentrantLock refreshLock = new ReentrantLock();
    private final ExecutorService refreshExecutor = Executors.newSingleThreadExecutor(r -> {
        Thread thread = new Thread(r, "advanced-insight-refresh");
        thread.setDaemon(true);
        return thread;
    });

    public AdvancedInsightService(FactSnapshotService factSnapshotService,
                                  InsightCandidateAggregator aggregator,
                                  @Value("${mcp.advanced.refresh-timeout-ms:120000}") long refreshTimeoutMs) {
        this.factSnapshotService = factSnapshotService;
        this.aggregator = aggregator;
        this.refreshTimeoutMs = refreshTimeoutMs;
    }

    public AdvancedInsightSnapshot current() {
        return current.get();
    }

    public AdvancedInsightSnapshot refresh() {
        boolean locked;
        try {
            locked = refreshLock.tryLock(refreshTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamUnavailableException("interrupted while waiting for a running refresh", e);
        }
        if (!locked) {
            throw new UpstreamUnavailableException("another advanced insight refresh is still running");
        }

        long start = System.currentTimeMillis();
        log.info("🔄 Advanced insight refresh started");
        Future<AdvancedInsightSnapshot> task = refreshExecutor.submit(this::computeSnapshot);
        try {
            AdvancedInsightSnapshot next = task.get(refreshTimeoutMs, TimeUnit.MILLISECONDS);
            current.set(next);
            log.info("✅ Advanced insight refresh finished: {} units in {}ms",
                    next.size(), System.currentTimeMillis() - start);
            return next;
        } catch (TimeoutException e) {
            task.cancel(true);
            log.warn("⚠️  Advanced insight refresh timed out after {}ms, keeping last result ({})",
                    refreshTimeoutMs, current.get().getRefreshedAt());
            throw new UpstreamUnavailableException("advanced insight refresh timed out after " + refreshTimeoutMs + "ms", e);
        } catch (InterruptedException e) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            throw new UpstreamUnavailableException("advanced insight refresh interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            log.warn("⚠️  Advanced insight refresh failed, keeping last result ({}): {}",
                    current.get().getRefreshedAt(), cause.getMessage());
            if (cause instanceof InsightException) {
                throw (InsightException) cause;
            }
            throw new UpstreamUnavailableException("advanced insight refresh failed: " + cause.getMessage(), cause);
        } finally {
            refreshLock.unlock();
        }
    }

    private AdvancedInsightSnapshot computeSnapshot() {
        FactSnapshot snapshot = factSnapshotService.load();
        List<InsightCandidate> candidates = aggregator.aggregate(snapshot);
        return new AdvancedInsightSnapshot(Instant.now(), compute(candidates),
                snapshot.getSources(), snapshot.getWarnings(), snapshot.getDirectory());
    }

    /**
     * Statistics over the rows where both sales and foot traffic are present, grouped by
     * (level, label). Units without any such row are left out.
     */
    public List<AdvancedInsight> compute(List<InsightCandidate> candidates) {
        Map<String, List<InsightCandidate>> groups = new LinkedHashMap<>();
        for (InsightCandidate candidate : candidates) {
            if (candidate.value(Metric.SALES) == null
                    || candidate.value(Metric.FOOT_TRAFFIC) == null) {
                continue;
            }
            groups.computeIfAbsent(candidate.getLevel().getValue() + "|" + candidate.getSpatialLabel(),
                    k -> new ArrayList<>()).add(candidate);
        }

        List<AdvancedInsight> insights = new ArrayList<>(groups.size());
        for (List<InsightCandidate> pairs : groups.values()) {
            int n = pairs.size();
            double[] footTraffic = new double[n];
            double[] sales = new double[n];
            List<Double> footTrafficZ = new ArrayList<>(n);
            List<Double> salesZ = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                InsightCandidate pair = pairs.get(i);
                footTraffic[i] = pair.getFootTraffic().getValue();
                sales[i] = pair.getSales().getValue();
                footTrafficZ.add(pair.getFootTraffic().getZscore());
                salesZ.add(pair.getSales().getZscore());
            }
            InsightCandidate first = pairs.get(0);
            SpatialLevel level = first.getLevel();
            insights.add(AdvancedInsight.builder()
                    .level(level)
                    .spatialLabel(first.getSpatialLabel())
                    .pairCount(n)
                    .correlation(SeriesStatistics.pearson(footTraffic, sales))
                    .salesImpactSlope(SeriesStatistics.olsSlope(footTraffic, sales))
                    .salesImpactScore(SeriesStatistics.meanAbsolute(salesZ))
                    .footTrafficImpactScore(SeriesStatistics.meanAbsolute(footTrafficZ))
                    .build());
        }
        return insights;
    }

    @PreDestroy
    public void shutdown() {
        refreshExecutor.shutdownNow();
    }
}
