package com.geoinsight.mcp.service;

import com.geoinsight.mcp.config.AdminCodeDirectoryLoader;
import com.geoinsight.mcp.exception.InternalInvariantException;
import com.geoinsight.mcp.exception.UpstreamUnavailableException;
import com.geoinsight.mcp.model.ActivityFact;
import com.geoinsight.mcp.model.DemographicFact;
import com.geoinsight.mcp.service.spatial.SpatialDirectory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Reads a consistent {@link FactSnapshot} from the fact store and checks it.
 *
 * Two rows with the same primary key are an invariant violation and fail the request.
 * Several sources on one (spatial key, date) are legal and summed downstream; they only
 * produce a warning because disjoint source identifiers are the ingestion's responsibility.
 */
@Service
@Slf4j
public class FactSnapshotService {

    private static final int MAX_OVERLAP_EXAMPLES = 5;

    private final FactStore factStore;
    private final AdminCodeDirectoryLoader adminCodeDirectory;

    @Value("${mcp.granularity:month}")
    private String granularity = "month";

    public FactSnapshotService(FactStore factStore, AdminCodeDirectoryLoader adminCodeDirectory) {
        this.factStore = factStore;
        this.adminCodeDirectory = adminCodeDirectory;
    }

    public FactSnapshot load() {
        long start = System.currentTimeMillis();
        List<ActivityFact> activity;
        List<DemographicFact> demographics;
        SpatialDirectory directory;
        try {
            activity = factStore.findActivityFacts(granularity);
            demographics = factStore.findDemographicFacts(granularity);
            directory = new SpatialDirectory(
                    factStore.findSpatialDimensions(),
                    factStore.findAdminDistricts(),
                    adminCodeDirectory.getSidoNamesByCode());
        } catch (DataAccessException e) {
            log.warn("⚠️  Fact store unavailable: {}", e.getMessage());
            throw new UpstreamUnavailableException("fact store unavailable: " + e.getMostSpecificCause().getMessage(), e);
        }

        checkActivityKeys(activity);
        checkDemographicKeys(demographics);

        Set<String> sources = new TreeSet<>();
        activity.forEach(f -> sources.add(f.getId().getSource()));
        demographics.forEach(f -> sources.add(f.getId().getSource()));

        List<String> warnings = overlapWarnings(activity);

        log.debug("Loaded fact snapshot: {} activity rows, {} demographic rows, {} sources in {}ms",
                activity.size(), demographics.size(), sources.size(), System.currentTimeMillis() - start);
        return new FactSnapshot(activity, demographics, directory, new ArrayList<>(sources), warnings);
    }

    private void checkActivityKeys(List<ActivityFact> facts) {
        Set<ActivityFact.Id> seen = new HashSet<>();
        for (ActivityFact fact : facts) {
            ActivityFact.Id id = fact.getId();
            if (id == null || id.getSpatialKey() == null || id.getDate() == null) {
                throw new InternalInvariantException("activity fact without a complete primary key");
            }
            if (!seen.add(id)) {
                log.error("❌ Duplicate activity fact key {}", id);
                throw new InternalInvariantException("duplicate activity fact for key ("
                        + id.getSpatialKey() + ", " + id.getDate() + ", " + id.getGranularity() + ", " + id.getSource() + ")");
            }
        }
    }

    private void checkDemographicKeys(List<DemographicFact> facts) {
        Set<DemographicFact.Id> seen = new HashSet<>();
        for (DemographicFact fact : facts) {
            DemographicFact.Id id = fact.getId();
            if (id == null || id.getSpatialKey() == null || id.getDate() == null) {
                throw new InternalInvariantException("demographic fact without a complete primary key");
            }
            if (!seen.add(id)) {
                log.error("❌ Duplicate demographic fact key {}", id);
                throw new InternalInvariantException("duplicate demographic fact for key ("
                        + id.getSpatialKey() + ", " + id.getDate() + ", " + id.getSource()
                        + ", " + id.getSex() + ", " + id.getAgeGroup() + ")");
            }
        }
    }

    private List<String> overlapWarnings(List<ActivityFact> facts) {
        Map<String, Set<String>> sourcesByCell = new TreeMap<>();
        for (ActivityFact fact : facts) {
            ActivityFact.Id id = fact.getId();
            sourcesByCell.computeIfAbsent(cell(id.getSpatialKey(), id.getDate()), k -> new TreeSet<>())
                    .add(id.getSource());
        }

        List<String> overlapping = new ArrayList<>();
        sourcesByCell.forEach((cell, cellSources) -> {
            if (cellSources.size() > 1) {
                overlapping.add(cell + " " + cellSources);
            }
        });
        if (overlapping.isEmpty()) {
            return List.of();
        }

        List<String> warnings = new ArrayList<>();
        int shown = Math.min(MAX_OVERLAP_EXAMPLES, overlapping.size());
        for (int i = 0; i < shown; i++) {
            warnings.add("source overlap summed at " + overlapping.get(i));
        }
        if (overlapping.size() > shown) {
            warnings.add("source overlap summed at " + (overlapping.size() - shown) + " more (spatial key, date) cells");
        }
        log.warn("⚠️  {} (spatial key, date) cells are contributed by more than one source; values are summed",
                overlapping.size());
        return warnings;
    }

    private static String cell(String spatialKey, LocalDate date) {
        return "(" + spatialKey + ", " + date + ")";
    }
}
