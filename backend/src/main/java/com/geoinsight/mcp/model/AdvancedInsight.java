package com.geoinsight.mcp.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Cross-metric statistics of one spatial unit over its whole observed history.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdvancedInsight {

    private SpatialLevel level;

    @JsonProperty("spatial_label")
    private String spatialLabel;

    /** Number of periods where both sales and foot traffic are present. */
    @JsonProperty("pair_count")
    private int pairCount;

    @JsonProperty("corr_sales_foot_traffic")
    private Double correlation;

    /** OLS slope of sales regressed on foot traffic. */
    @JsonProperty("sales_impact_slope")
    private Double salesImpactSlope;

    @JsonProperty("sales_impact_score")
    private Double salesImpactScore;

    @JsonProperty("foot_traffic_impact_score")
    private Double footTrafficImpactScore;
}
