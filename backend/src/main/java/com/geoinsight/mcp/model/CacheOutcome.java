package com.geoinsight.mcp.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of a semantic cache lookup.
 */
public enum CacheOutcome {

    EXACT_HIT("exact_hit"),
    NEAR_HIT("near_hit"),
    MISS("miss"),
    /** Translation failed; the default scope was served and nothing was stored. */
    MISS_FALLBACK("miss_fallback");

    private final String value;

    CacheOutcome(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
