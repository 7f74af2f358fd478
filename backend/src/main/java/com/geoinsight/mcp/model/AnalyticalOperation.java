package com.geoinsight.mcp.model;

import java.util.Optional;

/**
 * Operations a structured query can dispatch to.
 */
public enum AnalyticalOperation {

    COMPARE_DOMAINS("compare_domains"),
    GET_RANKINGS("get_rankings"),
    DETECT_ANOMALY("detect_anomaly"),
    GET_ADVANCED_INSIGHT("get_advanced_insight");

    public static final String PATTERN = "compare_domains|get_rankings|detect_anomaly|get_advanced_insight";

    private final String value;

    AnalyticalOperation(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<AnalyticalOperation> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (AnalyticalOperation operation : values()) {
            if (operation.value.equals(value)) {
                return Optional.of(operation);
            }
        }
        return Optional.empty();
    }
}
