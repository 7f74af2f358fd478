package com.geoinsight.mcp.service.spatial;

import com.geoinsight.mcp.model.AdminDistrict;
import com.geoinsight.mcp.model.SpatialLevel;

import java.util.Optional;

/**
 * Fixed-width prefix of the unit's administrative code: the first 5 digits name the district,
 * the first 2 the province. Provinces missing from admin_sig fall back to the static code table.
 */
public class CodePrefixStrategy implements SpatialResolutionStrategy {

    private static final int DISTRICT_CODE_LENGTH = SpatialLevel.INTERMEDIATE.getCodePrefixLength();

    @Override
    public Optional<String> resolve(String rawKey, SpatialLevel level, SpatialDirectory directory) {
        Optional<String> code = directory.codeOf(rawKey);
        if (code.isEmpty()) {
            return Optional.empty();
        }
        String value = code.get();

        if (level == SpatialLevel.INTERMEDIATE) {
            return district(value, directory).map(AdminDistrict::getSigName);
        }
        if (level == SpatialLevel.COARSEST) {
            Optional<String> viaDistrict = district(value, directory).map(AdminDistrict::getSidoName);
            if (viaDistrict.isPresent()) {
                return viaDistrict;
            }
            int width = SpatialLevel.COARSEST.getCodePrefixLength();
            if (value.length() >= width) {
                return directory.provinceNameByCode(value.substring(0, width));
            }
        }
        return Optional.empty();
    }

    private Optional<AdminDistrict> district(String code, SpatialDirectory directory) {
        if (code.length() < DISTRICT_CODE_LENGTH) {
            return Optional.empty();
        }
        return directory.districtByCode(code.substring(0, DISTRICT_CODE_LENGTH))
                .filter(d -> d.getSigName() != null);
    }

    @Override
    public String name() {
        return "code-prefix";
    }
}
