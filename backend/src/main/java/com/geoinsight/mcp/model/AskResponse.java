package com.geoinsight.mcp.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AskResponse {

    private String question;
    private String operation;
    private CacheResolution resolution;
    private ToolResponse<?> result;
}
