package com.geoinsight.mcp.service;

import com.geoinsight.mcp.model.ActivityFact;
import com.geoinsight.mcp.model.AdminDistrict;
import com.geoinsight.mcp.model.DemographicFact;
import com.geoinsight.mcp.model.SpatialDimension;

import java.util.List;

/**
 * Read-only view over the normalized facts and spatial directories written by ingestion.
 * Nothing in the engine writes through this interface.
 */
public interface FactStore {

    List<ActivityFact> findActivityFacts(String granularity);

    List<DemographicFact> findDemographicFacts(String granularity);

    List<SpatialDimension> findSpatialDimensions();

    List<AdminDistrict> findAdminDistricts();
}
