package com.geoinsight.mcp.service.spatial;

import com.geoinsight.mcp.model.AdminDistrict;
import com.geoinsight.mcp.model.SpatialDimension;
import com.geoinsight.mcp.model.SpatialLevel;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Label match against district and province names. Tried with the finest label first, then the raw key.
 * A district name shared by several provinces ("중구") only resolves when the label also carries the
 * province, as in "서울특별시 중구"; otherwise it stays unresolved rather than guessing.
 */
public class NameMatchStrategy implements SpatialResolutionStrategy {

    @Override
    public Optional<String> resolve(String rawKey, SpatialLevel level, SpatialDirectory directory) {
        if (level == SpatialLevel.FINEST) {
            return Optional.empty();
        }
        for (String candidate : candidates(rawKey, directory)) {
            Optional<String> match = level == SpatialLevel.INTERMEDIATE
                    ? matchDistrict(candidate, directory)
                    : matchProvince(candidate, directory);
            if (match.isPresent()) {
                return match;
            }
        }
        return Optional.empty();
    }

    private List<String> candidates(String rawKey, SpatialDirectory directory) {
        Set<String> candidates = new LinkedHashSet<>();
        directory.dimension(rawKey)
                .map(SpatialDimension::getSpatialLabel)
                .filter(label -> !label.isBlank())
                .ifPresent(label -> candidates.add(label.trim()));
        if (rawKey != null && !rawKey.isBlank()) {
            candidates.add(rawKey.trim());
        }
        return new ArrayList<>(candidates);
    }

    private Optional<String> matchDistrict(String label, SpatialDirectory directory) {
        return uniqueDistrict(label, directory).map(AdminDistrict::getSigName);
    }

    private Optional<String> matchProvince(String label, SpatialDirectory directory) {
        if (directory.isProvinceName(label)) {
            return Optional.of(label);
        }
        String[] tokens = label.split(" ");
        if (tokens.length > 1 && directory.isProvinceName(tokens[0])) {
            return Optional.of(tokens[0]);
        }
        return uniqueDistrict(label, directory).map(AdminDistrict::getSidoName);
    }

    private Optional<AdminDistrict> uniqueDistrict(String label, SpatialDirectory directory) {
        List<AdminDistrict> exact = directory.districtsByName(label);
        if (exact.size() == 1) {
            return Optional.of(exact.get(0));
        }
        String[] tokens = label.split(" ");
        if (tokens.length < 2) {
            return Optional.empty();
        }
        // "<province> <district> [<neighborhood>]"
        String province = tokens[0];
        for (int i = 1; i < tokens.length; i++) {
            List<AdminDistrict> inProvince = directory.districtsByName(tokens[i]).stream()
                    .filter(d -> province.equals(d.getSidoName()))
                    .collect(Collectors.toList());
            if (inProvince.size() == 1) {
                return Optional.of(inProvince.get(0));
            }
        }
        return Optional.empty();
    }

    @Override
    public String name() {
        return "name-match";
    }
}
