package com.geoinsight.mcp.repository;

import com.geoinsight.mcp.model.AdminDistrict;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AdminDistrictRepository extends JpaRepository<AdminDistrict, String> {
}
