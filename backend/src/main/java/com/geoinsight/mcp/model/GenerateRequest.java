package com.geoinsight.mcp.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class GenerateRequest {
    private String model;
    private String prompt;
    private Integer maxTokens;
    private Double temperature;
    private String responseFormat;  // "json" asks the model for a bare JSON object
}
