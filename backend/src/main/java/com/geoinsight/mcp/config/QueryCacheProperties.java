package com.geoinsight.mcp.config;

import com.geoinsight.mcp.model.StructuredQuery;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "mcp.query-cache")
@Data
public class QueryCacheProperties {

    private String schemaVersion = StructuredQuery.SCHEMA_VERSION;

    /** Parser model name; part of the parser identity in the fingerprint. */
    private String parserModel = "gemini-1.5-flash";

    /** Maximum cosine distance for a near hit (0.08 ⇔ similarity 0.92). */
    private double maxDistance = 0.08;

    private int topK = 5;

    private IndexType index = IndexType.MEMORY;

    private long translatorTimeoutMs = 30000;

    private long embeddingTimeoutMs = 5000;

    private long shutdownFlushTimeoutMs = 10000;

    public enum IndexType {
        MEMORY, PGVECTOR
    }
}
