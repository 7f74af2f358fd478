package com.geoinsight.mcp.repository;

import com.geoinsight.mcp.model.ActivityFact;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ActivityFactRepository extends JpaRepository<ActivityFact, ActivityFact.Id> {

    List<ActivityFact> findByIdGranularity(String granularity);
}
