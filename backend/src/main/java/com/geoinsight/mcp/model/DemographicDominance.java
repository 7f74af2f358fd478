package com.geoinsight.mcp.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DemographicDominance {

    private String spatialLabel;
    private LocalDate date;

    /** sex + "_" + age group, e.g. "F_30s" */
    private String dominantGroup;

    private Double dominantValue;
    private Double total;

    /** dominantValue / total, null when the total is zero */
    private Double dominantShare;
}
