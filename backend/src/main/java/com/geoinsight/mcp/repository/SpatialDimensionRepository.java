package com.geoinsight.mcp.repository;

import com.geoinsight.mcp.model.SpatialDimension;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SpatialDimensionRepository extends JpaRepository<SpatialDimension, String> {
}
