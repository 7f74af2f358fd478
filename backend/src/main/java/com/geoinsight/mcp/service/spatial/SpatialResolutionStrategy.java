package com.geoinsight.mcp.service.spatial;

import com.geoinsight.mcp.model.SpatialLevel;

import java.util.Optional;

/**
 * One rule of a level's resolution chain. Returns the canonical label for the level,
 * or empty to let the next rule try.
 */
public interface SpatialResolutionStrategy {

    Optional<String> resolve(String rawKey, SpatialLevel level, SpatialDirectory directory);

    String name();
}
