package com.geoinsight.mcp.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.geoinsight.mcp.exception.InvalidArgumentException;

import java.util.Locale;

/**
 * Activity metrics carried through the windowed engine.
 */
public enum Metric {

    FOOT_TRAFFIC("foot_traffic"),
    SALES("sales");

    private final String column;

    Metric(String column) {
        this.column = column;
    }

    @JsonValue
    public String getColumn() {
        return column;
    }

    public static Metric parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidArgumentException("metric is required");
        }
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "activity_volume":
            case "foot_traffic":
                return FOOT_TRAFFIC;
            case "sales":
                return SALES;
            default:
                throw new InvalidArgumentException(
                        "metric must be one of: activity_volume, foot_traffic, sales (got '" + raw + "')");
        }
    }
}
