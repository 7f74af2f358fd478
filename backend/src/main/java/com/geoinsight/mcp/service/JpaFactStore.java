package com.geoinsight.mcp.service;

import com.geoinsight.mcp.model.ActivityFact;
import com.geoinsight.mcp.model.AdminDistrict;
import com.geoinsight.mcp.model.DemographicFact;
import com.geoinsight.mcp.model.SpatialDimension;
import com.geoinsight.mcp.repository.ActivityFactRepository;
import com.geoinsight.mcp.repository.AdminDistrictRepository;
import com.geoinsight.mcp.repository.DemographicFactRepository;
import com.geoinsight.mcp.repository.SpatialDimensionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Component
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class JpaFactStore implements FactStore {

    private final ActivityFactRepository activityRepository;
    private final DemographicFactRepository demographicRepository;
    private final SpatialDimensionRepository spatialRepository;
    private final AdminDistrictRepository adminRepository;

    @Override
    public List<ActivityFact> findActivityFacts(String granularity) {
        return activityRepository.findByIdGranularity(granularity);
    }

    @Override
    public List<DemographicFact> findDemographicFacts(String granularity) {
        return demographicRepository.findByIdGranularity(granularity);
    }

    @Override
    public List<SpatialDimension> findSpatialDimensions() {
        return spatialRepository.findAll();
    }

    @Override
    public List<AdminDistrict> findAdminDistricts() {
        return adminRepository.findAll();
    }
}
