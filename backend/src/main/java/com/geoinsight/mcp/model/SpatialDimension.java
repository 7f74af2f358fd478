package com.geoinsight.mcp.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Finest-level spatial directory entry (dim_spatial). The raw key is whatever identifier a source
 * used; code and label are filled in by the geo backfill when it can place the unit.
 */
@Entity
@Table(name = "dim_spatial")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SpatialDimension {

    @Id
    @Column(name = "spatial_key")
    private String spatialKey;

    @Column(name = "spatial_label")
    private String spatialLabel;

    @Column(name = "spatial_type")
    private String spatialType;  // emd | sig | grid

    // Administrative code, e.g. a 10-digit legal-dong code whose first 5 digits name the district
    @Column(name = "code")
    private String code;

    @Column(name = "emd_code")
    private String emdCode;

    @Column(name = "lat")
    private Double lat;

    @Column(name = "lon")
    private Double lon;
}
