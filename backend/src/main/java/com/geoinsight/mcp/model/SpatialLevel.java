package com.geoinsight.mcp.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.geoinsight.mcp.exception.InvalidArgumentException;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Three nested administrative granularities, finest first.
 * Each level accepts its canonical name plus the legacy view codes (norm/emd, sig, sido).
 */
public enum SpatialLevel {

    FINEST("finest", 0, "norm", "emd"),
    INTERMEDIATE("intermediate", 5, "sig"),
    COARSEST("coarsest", 2, "sido");

    private final String value;
    private final int codePrefixLength;
    private final List<String> aliases;

    SpatialLevel(String value, int codePrefixLength, String... aliases) {
        this.value = value;
        this.codePrefixLength = codePrefixLength;
        this.aliases = Arrays.asList(aliases);
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Number of leading digits of an administrative code identifying a unit of this level,
     * 0 when the level is not addressed by code prefix.
     */
    public int getCodePrefixLength() {
        return codePrefixLength;
    }

    /**
     * Parse a level name, falling back to {@code defaultLevel} when the input is blank.
     */
    public static SpatialLevel parse(String raw, SpatialLevel defaultLevel) {
        if (raw == null || raw.isBlank()) {
            return defaultLevel;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (SpatialLevel level : values()) {
            if (level.value.equals(normalized) || level.aliases.contains(normalized)) {
                return level;
            }
        }
        throw new InvalidArgumentException("level must be one of: finest, intermediate, coarsest (got '" + raw + "')");
    }
}
