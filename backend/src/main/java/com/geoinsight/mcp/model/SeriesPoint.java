package com.geoinsight.mcp.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

/**
 * Facts summed into one (spatial label, date) cell at a given level; input of the windowed engine.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SeriesPoint {

    private String spatialLabel;
    private LocalDate date;
    private Double footTraffic;
    private Double sales;
    private Double salesCount;
    private List<String> sources;

    public Double valueOf(Metric metric) {
        return metric == Metric.FOOT_TRAFFIC ? footTraffic : sales;
    }
}
