package com.geoinsight.mcp.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

/**
 * One row of the unified candidate collection: exactly one per (level, spatial label, date).
 * Demographic fields are filled at the finest level only.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"level", "spatial_label", "date", "foot_traffic", "sales", "sales_count",
        "dominant_group", "dominant_share", "sources"})
public class InsightCandidate {

    private SpatialLevel level;

    @JsonProperty("spatial_label")
    private String spatialLabel;

    private LocalDate date;

    @JsonProperty("foot_traffic")
    private MetricWindow footTraffic;

    private MetricWindow sales;

    @JsonProperty("sales_count")
    private Double salesCount;

    @JsonProperty("dominant_group")
    private String dominantGroup;

    @JsonProperty("dominant_share")
    private Double dominantShare;

    private List<String> sources;

    public MetricWindow window(Metric metric) {
        return metric == Metric.FOOT_TRAFFIC ? footTraffic : sales;
    }

    public Double value(Metric metric) {
        MetricWindow window = window(metric);
        return window != null ? window.getValue() : null;
    }
}
