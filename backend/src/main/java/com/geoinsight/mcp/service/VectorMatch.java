package com.geoinsight.mcp.service;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class VectorMatch {
    private String id;
    private double distance;  // 1 - cosine similarity
}
