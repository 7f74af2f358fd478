package com.geoinsight.mcp.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdvancedInsightResult {

    private String region;
    private List<Domain> domains;

    /** Null when the region has no insight in the last refreshed set. */
    private AdvancedInsight insight;
}
