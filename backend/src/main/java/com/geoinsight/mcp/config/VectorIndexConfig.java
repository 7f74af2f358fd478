package com.geoinsight.mcp.config;

import com.geoinsight.mcp.repository.QueryMappingRepository;
import com.geoinsight.mcp.service.InMemoryVectorIndex;
import com.geoinsight.mcp.service.PgVectorIndex;
import com.geoinsight.mcp.service.VectorIndex;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the nearest-neighbour index behind the semantic cache ({@code mcp.query-cache.index}).
 */
@Configuration
@Slf4j
public class VectorIndexConfig {

    @Bean
    @ConditionalOnProperty(name = "mcp.query-cache.index", havingValue = "memory", matchIfMissing = true)
    public VectorIndex inMemoryVectorIndex() {
        log.info("Semantic cache index: in-memory cosine search");
        return new InMemoryVectorIndex();
    }

    @Bean
    @ConditionalOnProperty(name = "mcp.query-cache.index", havingValue = "pgvector")
    public VectorIndex pgVectorIndex(QueryMappingRepository repository, QueryCacheProperties properties) {
        log.info("Semantic cache index: pgvector on query_mapping_cache");
        return new PgVectorIndex(repository, properties.getSchemaVersion());
    }
}
