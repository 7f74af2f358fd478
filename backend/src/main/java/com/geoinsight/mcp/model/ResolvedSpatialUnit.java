package com.geoinsight.mcp.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Canonical labels of a raw spatial key at each level. A null label means the level could not be
 * resolved; {@link #labelAt(SpatialLevel)} then falls back to the raw key so nothing is dropped.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResolvedSpatialUnit {

    private String rawKey;
    private String code;
    private String finest;
    private String intermediate;
    private String coarsest;

    public String resolvedAt(SpatialLevel level) {
        switch (level) {
            case FINEST:
                return finest;
            case INTERMEDIATE:
                return intermediate;
            default:
                return coarsest;
        }
    }

    public String labelAt(SpatialLevel level) {
        String label = resolvedAt(level);
        return label != null ? label : rawKey;
    }

    public boolean isResolvedAt(SpatialLevel level) {
        return resolvedAt(level) != null;
    }
}
