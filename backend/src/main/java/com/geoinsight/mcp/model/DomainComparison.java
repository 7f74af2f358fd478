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
public class DomainComparison {

    private Domain domain;
    private Metric metric;
    private Double value;

    @JsonProperty("change_rate")
    private Double changeRate;

    @JsonProperty("yoy_rate")
    private Double yoyRate;

    private String trend;   // up | down | flat
    private String signal;  // strong_change | moderate_change | minor_change | insufficient_data
}
