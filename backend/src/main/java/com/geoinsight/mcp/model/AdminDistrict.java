package com.geoinsight.mcp.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Intermediate-level administrative unit (admin_sig) with its parent province.
 */
@Entity
@Table(name = "admin_sig")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AdminDistrict {

    @Id
    @Column(name = "sig_code", length = 5)
    private String sigCode;

    @Column(name = "sig_name", nullable = false)
    private String sigName;

    @Column(name = "sido_code", length = 2)
    private String sidoCode;

    @Column(name = "sido_name")
    private String sidoName;
}
