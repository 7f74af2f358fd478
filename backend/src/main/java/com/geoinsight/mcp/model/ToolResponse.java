package com.geoinsight.mcp.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Envelope returned by every analytical operation: structured data plus provenance metadata.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ToolResponse<T> {
    private T data;
    private ResponseMetadata metadata;
}
