package com.geoinsight.mcp.service;

import com.geoinsight.mcp.model.ActivityFact;
import com.geoinsight.mcp.model.DemographicFact;
import com.geoinsight.mcp.service.spatial.SpatialDirectory;
import lombok.Getter;

import java.util.List;

/**
 * Facts and directories read once per request. Every derived result of a request is computed
 * from the same snapshot, which is what makes recomputation reproducible.
 */
@Getter
public class FactSnapshot {

    private final List<ActivityFact> activityFacts;
    private final List<DemographicFact> demographicFacts;
    private final SpatialDirectory directory;
    private final List<String> sources;
    private final List<String> warnings;

    public FactSnapshot(List<ActivityFact> activityFacts, List<DemographicFact> demographicFacts,
                        SpatialDirectory directory, List<String> sources, List<String> warnings) {
        this.activityFacts = List.copyOf(activityFacts);
        this.demographicFacts = List.copyOf(demographicFacts);
        this.directory = directory;
        this.sources = List.copyOf(sources);
        this.warnings = List.copyOf(warnings);
    }
}
