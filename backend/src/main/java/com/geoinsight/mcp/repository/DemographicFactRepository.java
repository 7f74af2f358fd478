package com.geoinsight.mcp.repository;

import com.geoinsight.mcp.model.DemographicFact;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DemographicFactRepository extends JpaRepository<DemographicFact, DemographicFact.Id> {

    List<DemographicFact> findByIdGranularity(String granularity);
}
