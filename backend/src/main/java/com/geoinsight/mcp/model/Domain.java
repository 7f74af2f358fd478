package com.geoinsight.mcp.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.geoinsight.mcp.exception.InvalidArgumentException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Analytical domains exposed to the tool-calling layer, each backed by one metric.
 */
public enum Domain {

    POPULATION("population", Metric.FOOT_TRAFFIC),
    SALES("sales", Metric.SALES);

    private final String value;
    private final Metric metric;

    Domain(String value, Metric metric) {
        this.value = value;
        this.metric = metric;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public Metric getMetric() {
        return metric;
    }

    public static Domain parse(String raw) {
        if (raw != null) {
            String normalized = raw.trim().toLowerCase(Locale.ROOT);
            for (Domain domain : values()) {
                if (domain.value.equals(normalized)) {
                    return domain;
                }
            }
        }
        throw new InvalidArgumentException("domain must be one of: population, sales (got '" + raw + "')");
    }

    /**
     * Parse a domain list; an absent or empty list means every domain.
     * Duplicates collapse, order of first appearance is kept.
     */
    public static List<Domain> parseAll(List<String> raw) {
        if (raw == null || raw.isEmpty()) {
            return Arrays.asList(values());
        }
        Set<Domain> parsed = new LinkedHashSet<>();
        for (String value : raw) {
            parsed.add(parse(value));
        }
        return new ArrayList<>(parsed);
    }
}
