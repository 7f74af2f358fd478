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
 * Demographic breakdown of activity, one row per (sex, age group). Same additive merge rule as
 * {@link ActivityFact}.
 */
@Entity
@Table(name = "gold_demographics", indexes = {
    @Index(name = "idx_gold_demographics_date", columnList = "date"),
    @Index(name = "idx_gold_demographics_group", columnList = "sex,age_group")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DemographicFact {

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
        private String granularity;

        @Column(name = "source", nullable = false)
        private String source;

        @Column(name = "sex", nullable = false)
        private String sex;

        @Column(name = "age_group", nullable = false)
        private String ageGroup;
    }

    @EmbeddedId
    private Id id;

    @Column(name = "value")
    private Double value;
}
