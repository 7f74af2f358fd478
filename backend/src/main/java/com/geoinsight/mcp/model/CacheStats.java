package com.geoinsight.mcp.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStats {
    private long exactHits;
    private long nearHits;
    private long misses;
    private long fallbacks;
    private long translatorFailures;
    private long embeddingFailures;
    private long aliasesWritten;
    private double hitRate;
    private int indexSize;
}
