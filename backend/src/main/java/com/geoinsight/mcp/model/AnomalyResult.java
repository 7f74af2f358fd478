package com.geoinsight.mcp.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyResult {

    private String region;
    private Metric metric;
    private LocalDate period;
    private Double value;
    private Double zscore;
    private Double threshold;

    @JsonProperty("is_anomaly")
    private boolean anomaly;
}
