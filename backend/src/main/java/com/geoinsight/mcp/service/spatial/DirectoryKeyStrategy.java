package com.geoinsight.mcp.service.spatial;

import com.geoinsight.mcp.model.SpatialDimension;
import com.geoinsight.mcp.model.SpatialLevel;

import java.util.Optional;

/**
 * Exact match of the raw key against the finest-level directory.
 */
public class DirectoryKeyStrategy implements SpatialResolutionStrategy {

    @Override
    public Optional<String> resolve(String rawKey, SpatialLevel level, SpatialDirectory directory) {
        return directory.dimension(rawKey)
                .map(SpatialDimension::getSpatialLabel)
                .filter(label -> !label.isBlank())
                .map(String::trim);
    }

    @Override
    public String name() {
        return "directory-key";
    }
}
