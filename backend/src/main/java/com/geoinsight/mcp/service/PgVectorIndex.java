package com.geoinsight.mcp.service;

import com.geoinsight.mcp.repository.QueryMappingRepository;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Searches the embedding column of query_mapping_cache with pgvector's {@code <=>} operator.
 * Rows are the index: inserting is done by saving the entry, so {@link #insert} does nothing.
 */
@Slf4j
public class PgVectorIndex implements VectorIndex {

    private final QueryMappingRepository repository;
    private final String schemaVersion;

    public PgVectorIndex(QueryMappingRepository repository, String schemaVersion) {
        this.repository = repository;
        this.schemaVersion = schemaVersion;
    }

    @Override
    public void insert(String id, double[] vector) {
        // persisted with the entry
    }

    @Override
    public List<VectorMatch> query(double[] vector, int k) {
        List<Object[]> rows = repository.findNearest(EmbeddingVectors.format(vector), schemaVersion, k);
        List<VectorMatch> matches = new ArrayList<>(rows.size());
        for (Object[] row : rows) {
            matches.add(new VectorMatch((String) row[0], ((Number) row[1]).doubleValue()));
        }
        log.debug("pgvector search returned {} candidates", matches.size());
        return matches;
    }

    @Override
    public int size() {
        return (int) repository.count();
    }
}
