package com.geoinsight.mcp.service;

import com.geoinsight.mcp.exception.InvalidArgumentException;
import com.geoinsight.mcp.model.AdvancedInsight;
import com.geoinsight.mcp.model.AdvancedInsightResult;
import com.geoinsight.mcp.model.AdvancedInsightSnapshot;
import com.geoinsight.mcp.model.AnomalyResult;
import com.geoinsight.mcp.model.CompareDomainsResult;
import com.geoinsight.mcp.model.Domain;
import com.geoinsight.mcp.model.DomainComparison;
import com.geoinsight.mcp.model.InsightCandidate;
import com.geoinsight.mcp.model.Metric;
import com.geoinsight.mcp.model.MetricWindow;
import com.geoinsight.mcp.model.PeriodRange;
import com.geoinsight.mcp.model.RankingEntry;
import com.geoinsight.mcp.model.RankingsResult;
import com.geoinsight.mcp.model.ResponseMetadata;
import com.geoinsight.mcp.model.SpatialLevel;
import com.geoinsight.mcp.model.ToolResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * The four analytical operations exposed to the tool-calling layer.
 *
 * Arguments are validated before the fact store is read. Each call recomputes candidates from a
 * fresh snapshot, except the advanced insight read, which serves the last refreshed set.
 */
@Service
@Slf4j
public class InsightQueryService {

    static final int DEFAULT_TOP_K = 10;
    static final int MAX_TOP_K = 100;
    static final double DEFAULT_Z_THRESHOLD = 2.0;
    static final double STRONG_CHANGE = 0.2;
    static final double MODERATE_CHANGE = 0.05;

    private final FactSnapshotService factSnapshotService;
    private final InsightCandidateAggregator aggregator;
    private final SpatialResolverService resolverService;
    private final AdvancedInsightService advancedInsightService;

    @Value("${mcp.default-level:intermediate}")
    private String defaultLevel = SpatialLevel.INTERMEDIATE.getValue();

    public InsightQueryService(FactSnapshotService factSnapshotService,
                               InsightCandidateAggregator aggregator,
                               SpatialResolverService resolverService,
                               AdvancedInsightService advancedInsightService) {
        this.factSnapshotService = factSnapshotService;
        this.aggregator = aggregator;
        this.resolverService = resolverService;
        this.advancedInsightService = advancedInsightService;
    }

    /**
     * Latest period of each domain for a region, with its month-over-month trend. Without a region
     * the comparison runs on the cross-sectional mean of all units at the level.
     */
    public ToolResponse<CompareDomainsResult> compareDomains(String region, String periodFrom, String periodTo,
                                                             List<String> domains, String level) {
        SpatialLevel spatialLevel = level(level);
        List<Domain> selected = Domain.parseAll(domains);
        PeriodRange range = PeriodRange.between(periodFrom, periodTo);

        FactSnapshot snapshot = factSnapshotService.load();
        List<InsightCandidate> candidates = aggregator.aggregate(snapshot, spatialLevel);
        List<String> warnings = new ArrayList<>(snapshot.getWarnings());

        CompareDomainsResult result;
        Set<String> sources = new TreeSet<>();
        if (isBlank(region)) {
            result = compareCrossSection(candidates, selected, range, sources, warnings);
        } else {
            String label = resolverService.canonicalRegion(region, spatialLevel, snapshot.getDirectory());
            Optional<InsightCandidate> latest = latestFor(candidates, label, range);
            List<DomainComparison> comparisons = new ArrayList<>();
            for (Domain domain : selected) {
                MetricWindow window = latest.map(c -> c.window(domain.getMetric())).orElse(null);
                comparisons.add(comparison(domain,
                        window != null ? window.getValue() : null,
                        window != null ? window.getMomPct() : null,
                        window != null ? window.getYoyPct() : null));
            }
            latest.ifPresent(c -> sources.addAll(c.getSources()));
            if (latest.isEmpty()) {
                warnings.add("no data for region '" + label + "' in the requested period");
            }
            result = new CompareDomainsResult(label, latest.map(InsightCandidate::getDate).orElse(null), comparisons);
        }

        return response(result, sources, range, result.getDate(), spatialLevel, warnings);
    }

    private CompareDomainsResult compareCrossSection(List<InsightCandidate> candidates, List<Domain> domains,
                                                     PeriodRange range, Set<String> sources, List<String> warnings) {
        TreeSet<LocalDate> allDates = candidates.stream()
                .map(InsightCandidate::getDate)
                .collect(Collectors.toCollection(TreeSet::new));
        Optional<LocalDate> target = allDates.stream().filter(range::contains).max(Comparator.naturalOrder());

        List<DomainComparison> comparisons = new ArrayList<>();
        if (target.isEmpty()) {
            warnings.add("no data in the requested period");
            for (Domain domain : domains) {
                comparisons.add(comparison(domain, null, null, null));
            }
            return new CompareDomainsResult(null, null, comparisons);
        }

        LocalDate date = target.get();
        LocalDate previous = allDates.lower(date);
        LocalDate previousYear = date.minusYears(1);
        for (Domain domain : domains) {
            Double current = crossSectionMean(candidates, date, domain.getMetric());
            Double prior = previous != null ? crossSectionMean(candidates, previous, domain.getMetric()) : null;
            Double priorYear = allDates.contains(previousYear)
                    ? crossSectionMean(candidates, previousYear, domain.getMetric()) : null;
            comparisons.add(comparison(domain, current,
                    SeriesStatistics.relativeChange(current, prior),
                    SeriesStatistics.relativeChange(current, priorYear)));
        }
        candidates.stream().filter(c -> date.equals(c.getDate())).forEach(c -> sources.addAll(c.getSources()));
        return new CompareDomainsResult(null, date, comparisons);
    }

    private Double crossSectionMean(List<InsightCandidate> candidates, LocalDate date, Metric metric) {
        List<Double> values = candidates.stream()
                .filter(c -> date.equals(c.getDate()))
                .map(c -> c.value(metric))
                .collect(Collectors.toList());
        return SeriesStatistics.mean(values);
    }

    private DomainComparison comparison(Domain domain, Double value, Double changeRate, Double yoyRate) {
        return DomainComparison.builder()
                .domain(domain)
                .metric(domain.getMetric())
                .value(value)
                .changeRate(changeRate)
                .yoyRate(yoyRate)
                .trend(trend(changeRate))
                .signal(signal(changeRate))
                .build();
    }

    static String trend(Double changeRate) {
        if (changeRate == null || changeRate == 0.0) {
            return "flat";
        }
        return changeRate > 0 ? "up" : "down";
    }

    static String signal(Double changeRate) {
        if (changeRate == null) {
            return "insufficient_data";
        }
        double magnitude = Math.abs(changeRate);
        if (magnitude >= STRONG_CHANGE) {
            return "strong_change";
        }
        if (magnitude >= MODERATE_CHANGE) {
            return "moderate_change";
        }
        return "minor_change";
    }

    /**
     * Top units by the metric on the latest date inside the period. Units without a value sort last.
     */
    public ToolResponse<RankingsResult> getRankings(String metric, String period, Integer topK, String level) {
        Metric selected = Metric.parse(metric);
        int limit = topK != null ? topK : DEFAULT_TOP_K;
        if (limit < 1 || limit > MAX_TOP_K) {
            throw new InvalidArgumentException("top_k must be between 1 and " + MAX_TOP_K + " (got " + limit + ")");
        }
        SpatialLevel spatialLevel = level(level);
        PeriodRange range = isBlank(period) ? PeriodRange.unbounded() : PeriodRange.of(period);

        FactSnapshot snapshot = factSnapshotService.load();
        List<InsightCandidate> candidates = aggregator.aggregate(snapshot, spatialLevel);
        List<String> warnings = new ArrayList<>(snapshot.getWarnings());

        Optional<LocalDate> target = candidates.stream()
                .map(InsightCandidate::getDate)
                .filter(range::contains)
                .max(Comparator.naturalOrder());
        Set<String> sources = new TreeSet<>();
        List<RankingEntry> rankings = new ArrayList<>();
        if (target.isPresent()) {
            List<InsightCandidate> onDate = candidates.stream()
                    .filter(c -> target.get().equals(c.getDate()))
                    .sorted(Comparator.comparing((InsightCandidate c) -> c.window(selected).getRank(),
                                    Comparator.nullsLast(Comparator.naturalOrder()))
                            .thenComparing(InsightCandidate::getSpatialLabel))
                    .limit(limit)
                    .collect(Collectors.toList());
            for (InsightCandidate candidate : onDate) {
                MetricWindow window = candidate.window(selected);
                rankings.add(RankingEntry.builder()
                        .rank(window.getRank())
                        .spatialLabel(candidate.getSpatialLabel())
                        .metric(selected)
                        .value(window.getValue())
                        .zscore(window.getZscore())
                        .build());
                sources.addAll(candidate.getSources());
            }
        } else {
            warnings.add("no data in the requested period");
        }

        RankingsResult result = new RankingsResult(selected, target.orElse(null), rankings);
        return response(result, sources, range, target.orElse(null), spatialLevel, warnings);
    }

    /**
     * Whether the region's latest value inside the period deviates from its own history by at
     * least {@code zThreshold} standard deviations.
     */
    public ToolResponse<AnomalyResult> detectAnomaly(String region, String domain, String period,
                                                     Double zThreshold, String level) {
        if (isBlank(region)) {
            throw new InvalidArgumentException("region is required for anomaly detection");
        }
        double threshold = zThreshold != null ? zThreshold : DEFAULT_Z_THRESHOLD;
        if (!(threshold > 0) || Double.isInfinite(threshold)) {
            throw new InvalidArgumentException("z_threshold must be a positive number (got " + zThreshold + ")");
        }
        Metric metric = metricOf(domain);
        SpatialLevel spatialLevel = level(level);
        PeriodRange range = isBlank(period) ? PeriodRange.unbounded() : PeriodRange.of(period);

        FactSnapshot snapshot = factSnapshotService.load();
        List<InsightCandidate> candidates = aggregator.aggregate(snapshot, spatialLevel);
        List<String> warnings = new ArrayList<>(snapshot.getWarnings());
        String label = resolverService.canonicalRegion(region, spatialLevel, snapshot.getDirectory());

        Optional<InsightCandidate> latest = latestFor(candidates, label, range);
        MetricWindow window = latest.map(c -> c.window(metric)).orElse(null);
        Double z = window != null ? window.getZscore() : null;
        if (latest.isEmpty()) {
            warnings.add("no data for region '" + label + "' in the requested period");
        } else if (z == null) {
            warnings.add("z-score undefined: fewer than two observations or no variation");
        }

        AnomalyResult result = AnomalyResult.builder()
                .region(label)
                .metric(metric)
                .period(latest.map(InsightCandidate::getDate).orElse(null))
                .value(window != null ? window.getValue() : null)
                .zscore(z)
                .threshold(threshold)
                .anomaly(z != null && Math.abs(z) >= threshold)
                .build();
        Set<String> sources = new TreeSet<>();
        latest.ifPresent(c -> sources.addAll(c.getSources()));
        return response(result, sources, range, result.getPeriod(), spatialLevel, warnings);
    }

    /**
     * Correlation and impact scores of a region from the last refresh. The period is validated and
     * echoed; the scores always cover the unit's full history. Raw spatial keys are translated with
     * the directory of that refresh, so the fact store is not read.
     */
    public ToolResponse<AdvancedInsightResult> getAdvancedInsight(String region, String period,
                                                                  List<String> domains, String level) {
        if (isBlank(region)) {
            throw new InvalidArgumentException("region is required for advanced insight");
        }
        List<Domain> selected = Domain.parseAll(domains);
        SpatialLevel spatialLevel = level(level);
        PeriodRange range = isBlank(period) ? PeriodRange.unbounded() : PeriodRange.of(period);

        AdvancedInsightSnapshot snapshot = advancedInsightService.current();
        List<String> warnings = new ArrayList<>(snapshot.getWarnings());
        String label = resolverService.canonicalRegion(region, spatialLevel, snapshot.getDirectory());
        AdvancedInsight insight = snapshot.find(spatialLevel, label).orElse(null);
        if (snapshot.isEmpty()) {
            warnings.add("advanced insights have not been computed yet");
        } else if (insight == null) {
            warnings.add("no advanced insight for region '" + label + "' at " + spatialLevel.getValue() + " level");
        }

        AdvancedInsightResult result = AdvancedInsightResult.builder()
                .region(label)
                .domains(selected)
                .insight(insight)
                .build();
        ResponseMetadata metadata = ResponseMetadata.builder()
                .sources(snapshot.getSources())
                .generatedAt(Instant.now())
                .periodFrom(range.getFrom())
                .periodTo(range.getTo())
                .level(spatialLevel)
                .lastRefreshedAt(snapshot.getRefreshedAt())
                .warnings(warnings)
                .build();
        return new ToolResponse<>(result, metadata);
    }

    private Optional<InsightCandidate> latestFor(List<InsightCandidate> candidates, String label, PeriodRange range) {
        return candidates.stream()
                .filter(c -> label.equals(c.getSpatialLabel()))
                .filter(c -> range.contains(c.getDate()))
                .max(Comparator.comparing(InsightCandidate::getDate));
    }

    static Metric metricOf(String domainOrMetric) {
        if (isBlank(domainOrMetric)) {
            return Domain.POPULATION.getMetric();
        }
        String normalized = domainOrMetric.trim().toLowerCase(Locale.ROOT);
        for (Domain domain : Domain.values()) {
            if (domain.getValue().equals(normalized)) {
                return domain.getMetric();
            }
        }
        try {
            return Metric.parse(normalized);
        } catch (InvalidArgumentException e) {
            throw new InvalidArgumentException("domain must be one of: population, sales (got '" + domainOrMetric + "')");
        }
    }

    private SpatialLevel level(String level) {
        return SpatialLevel.parse(level, SpatialLevel.parse(defaultLevel, SpatialLevel.INTERMEDIATE));
    }

    /**
     * Metadata with the period actually applied: open bounds are closed with the date that was used.
     */
    private <T> ToolResponse<T> response(T data, Set<String> sources, PeriodRange range, LocalDate used,
                                         SpatialLevel level, List<String> warnings) {
        ResponseMetadata metadata = ResponseMetadata.builder()
                .sources(new ArrayList<>(sources))
                .generatedAt(Instant.now())
                .periodFrom(range.getFrom() != null ? range.getFrom() : used)
                .periodTo(range.getTo() != null ? range.getTo() : used)
                .level(level)
                .warnings(warnings)
                .build();
        return new ToolResponse<>(data, metadata);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
