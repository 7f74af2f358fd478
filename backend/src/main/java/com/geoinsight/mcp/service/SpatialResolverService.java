package com.geoinsight.mcp.service;

import com.geoinsight.mcp.model.ResolvedSpatialUnit;
import com.geoinsight.mcp.model.SpatialLevel;
import com.geoinsight.mcp.service.spatial.CodePrefixStrategy;
import com.geoinsight.mcp.service.spatial.DirectoryKeyStrategy;
import com.geoinsight.mcp.service.spatial.NameMatchStrategy;
import com.geoinsight.mcp.service.spatial.SpatialDirectory;
import com.geoinsight.mcp.service.spatial.SpatialResolutionStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reconciles raw spatial keys to canonical labels at the three levels.
 *
 * Each level runs its own ordered rule chain and stops at the first rule that answers:
 * finest uses the key directory; intermediate and coarsest try the code prefix, then the name.
 * A level no rule answers stays unresolved and aggregation uses the raw key for it.
 */
@Service
@Slf4j
public class SpatialResolverService {

    private final Map<SpatialLevel, List<SpatialResolutionStrategy>> chains;

    public SpatialResolverService() {
        SpatialResolutionStrategy byKey = new DirectoryKeyStrategy();
        SpatialResolutionStrategy byCode = new CodePrefixStrategy();
        SpatialResolutionStrategy byName = new NameMatchStrategy();

        chains = new EnumMap<>(SpatialLevel.class);
        chains.put(SpatialLevel.FINEST, List.of(byKey));
        chains.put(SpatialLevel.INTERMEDIATE, List.of(byCode, byName));
        chains.put(SpatialLevel.COARSEST, List.of(byCode, byName));
    }

    public ResolvedSpatialUnit resolve(String rawKey, SpatialDirectory directory) {
        return ResolvedSpatialUnit.builder()
                .rawKey(rawKey)
                .code(directory.codeOf(rawKey).orElse(null))
                .finest(resolveLevel(rawKey, SpatialLevel.FINEST, directory).orElse(null))
                .intermediate(resolveLevel(rawKey, SpatialLevel.INTERMEDIATE, directory).orElse(null))
                .coarsest(resolveLevel(rawKey, SpatialLevel.COARSEST, directory).orElse(null))
                .build();
    }

    public Map<String, ResolvedSpatialUnit> resolveAll(Collection<String> rawKeys, SpatialDirectory directory) {
        Map<String, ResolvedSpatialUnit> resolved = new LinkedHashMap<>();
        int gaps = 0;
        for (String rawKey : rawKeys) {
            if (resolved.containsKey(rawKey)) {
                continue;
            }
            ResolvedSpatialUnit unit = resolve(rawKey, directory);
            if (!unit.isResolvedAt(SpatialLevel.INTERMEDIATE) || !unit.isResolvedAt(SpatialLevel.COARSEST)) {
                gaps++;
            }
            resolved.put(rawKey, unit);
        }
        if (gaps > 0) {
            log.debug("{} of {} spatial keys fall back to the raw key at a coarser level", gaps, resolved.size());
        }
        return resolved;
    }

    /**
     * Label a caller-supplied region refers to at the given level. A known raw key is translated;
     * anything else is taken as a label already.
     */
    public String canonicalRegion(String region, SpatialLevel level, SpatialDirectory directory) {
        String trimmed = region.trim();
        if (directory.dimension(trimmed).isPresent()) {
            return resolve(trimmed, directory).labelAt(level);
        }
        return trimmed;
    }

    private Optional<String> resolveLevel(String rawKey, SpatialLevel level, SpatialDirectory directory) {
        for (SpatialResolutionStrategy strategy : chains.get(level)) {
            Optional<String> label = strategy.resolve(rawKey, level, directory);
            if (label.isPresent()) {
                log.trace("{} -> {} at {} via {}", rawKey, label.get(), level.getValue(), strategy.name());
                return label;
            }
        }
        return Optional.empty();
    }
}
