package com.geoinsight.mcp.service.spatial;

import com.geoinsight.mcp.model.AdminDistrict;
import com.geoinsight.mcp.model.SpatialDimension;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Indexed, immutable copy of the three spatial directories taken from one fact snapshot:
 * finest units by raw key, intermediate districts by code and by name, provinces by code.
 */
public class SpatialDirectory {

    private final Map<String, SpatialDimension> dimensionsByKey;
    private final Map<String, AdminDistrict> districtsByCode;
    private final Map<String, List<AdminDistrict>> districtsByName;
    private final Map<String, String> provinceNamesByCode;
    private final Set<String> provinceNames;

    public SpatialDirectory(Collection<SpatialDimension> dimensions,
                            Collection<AdminDistrict> districts,
                            Map<String, String> provinceCodeDirectory) {
        Map<String, SpatialDimension> byKey = new HashMap<>();
        for (SpatialDimension dimension : dimensions) {
            if (dimension.getSpatialKey() != null) {
                byKey.put(dimension.getSpatialKey(), dimension);
            }
        }

        Map<String, AdminDistrict> byCode = new HashMap<>();
        Map<String, List<AdminDistrict>> byName = new HashMap<>();
        // admin_sig wins over the static code table for provinces it knows
        Map<String, String> provinces = new LinkedHashMap<>(provinceCodeDirectory);
        for (AdminDistrict district : districts) {
            if (district.getSigCode() == null) {
                continue;
            }
            byCode.put(district.getSigCode(), district);
            if (district.getSigName() != null) {
                byName.computeIfAbsent(district.getSigName().trim(), k -> new ArrayList<>()).add(district);
            }
            if (district.getSidoCode() != null && district.getSidoName() != null) {
                provinces.put(district.getSidoCode(), district.getSidoName());
            }
        }

        this.dimensionsByKey = Collections.unmodifiableMap(byKey);
        this.districtsByCode = Collections.unmodifiableMap(byCode);
        this.districtsByName = Collections.unmodifiableMap(byName);
        this.provinceNamesByCode = Collections.unmodifiableMap(provinces);
        this.provinceNames = Collections.unmodifiableSet(new LinkedHashSet<>(provinces.values()));
    }

    public static SpatialDirectory empty() {
        return new SpatialDirectory(List.of(), List.of(), Map.of());
    }

    public Optional<SpatialDimension> dimension(String rawKey) {
        return Optional.ofNullable(dimensionsByKey.get(rawKey));
    }

    public Optional<AdminDistrict> districtByCode(String sigCode) {
        return Optional.ofNullable(districtsByCode.get(sigCode));
    }

    public List<AdminDistrict> districtsByName(String sigName) {
        return districtsByName.getOrDefault(sigName, List.of());
    }

    public Optional<String> provinceNameByCode(String sidoCode) {
        return Optional.ofNullable(provinceNamesByCode.get(sidoCode));
    }

    public boolean isProvinceName(String name) {
        return provinceNames.contains(name);
    }

    /**
     * Administrative code of a raw key: dim_spatial code, then emd code, then the key itself
     * when it is purely numeric.
     */
    public Optional<String> codeOf(String rawKey) {
        SpatialDimension dimension = dimensionsByKey.get(rawKey);
        if (dimension != null) {
            if (hasDigits(dimension.getCode())) {
                return Optional.of(dimension.getCode().trim());
            }
            if (hasDigits(dimension.getEmdCode())) {
                return Optional.of(dimension.getEmdCode().trim());
            }
        }
        if (hasDigits(rawKey)) {
            return Optional.of(rawKey.trim());
        }
        return Optional.empty();
    }

    private static boolean hasDigits(String value) {
        return value != null && !value.isBlank() && value.trim().chars().allMatch(Character::isDigit);
    }
}
