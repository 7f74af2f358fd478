package com.geoinsight.mcp.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.LocalDate;

/**
 * Normalized activity measurement written by the ingestion pipeline.
 *
 * Rows sharing a spatial key and date but coming from different sources are summed downstream,
 * never overwritten. Source identifiers must therefore stay disjoint across feeds.
 */
@Entity
@Table(name = "gold_activity", indexes = {
    @Index(name = "idx_gold_activity_date", columnList = "date"),
    @Index(name = "idx_gold_activity_spatial", columnList = "spatial_key")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ActivityFact {

    @Embeddable
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Id implements Serializable {
        private static final long serialVersionUID = 1L;

        @Column(name = "spatial_key", nullable = false)
        private String spatialKey;

        @Column(name = "date", nullable = false)
        private LocalDate date;

        @Column(name = "granularity", nullable = false)
        private String granularity;  // month

        @Column(name = "source", nullable = false)
        private String source;
    }

    @EmbeddedId
    private Id id;

    @Column(name = "foot_traffic")
    private Double footTraffic;

    @Column(name = "sales")
    private Double sales;

    @Column(name = "sales_count")
    private Double salesCount;
}
