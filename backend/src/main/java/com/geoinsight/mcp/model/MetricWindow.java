package com.geoinsight.mcp.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Windowed statistics of one metric for one (spatial label, date). Every field is nullable:
 * an absent value means the statistic is undefined for the available data.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricWindow {

    private Double value;

    private Double previous;

    @JsonProperty("mom_pct")
    private Double momPct;

    @JsonProperty("previous_year")
    private Double previousYear;

    @JsonProperty("yoy_pct")
    private Double yoyPct;

    @JsonProperty("series_mean")
    private Double seriesMean;

    @JsonProperty("series_std")
    private Double seriesStd;

    @JsonProperty("zscore")
    private Double zscore;

    @JsonProperty("date_mean")
    private Double dateMean;

    private Integer rank;
}
