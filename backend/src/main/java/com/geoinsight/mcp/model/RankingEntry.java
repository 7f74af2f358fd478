package com.geoinsight.mcp.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RankingEntry {

    private Integer rank;

    @JsonProperty("spatial_label")
    private String spatialLabel;

    private Metric metric;
    private Double value;
    private Double zscore;
}
