package com.geoinsight.mcp.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompareDomainsResult {

    /** Null when the comparison ran on cross-sectional means (no region given). */
    private String region;
    private LocalDate date;
    private List<DomainComparison> comparisons;
}
