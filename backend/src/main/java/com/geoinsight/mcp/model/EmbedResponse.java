package com.geoinsight.mcp.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class EmbedResponse {
    private List<Double> embedding;
    private String model;      // e.g. BAAI/bge-m3
    private Boolean normalized;
}
