package com.geoinsight.mcp.repository;

import com.geoinsight.mcp.model.QueryMappingEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface QueryMappingRepository extends JpaRepository<QueryMappingEntry, String> {

    List<QueryMappingEntry> findBySchemaVersionAndEmbeddingIsNotNull(String schemaVersion);

    /**
     * Nearest cached requests by cosine distance. Rows are [request_hash, distance].
     */
    @Query(value = """
        SELECT request_hash,
               (embedding <=> CAST(:embedding AS vector)) AS distance
        FROM query_mapping_cache
        WHERE schema_version = :schemaVersion
          AND embedding IS NOT NULL
        ORDER BY embedding <=> CAST(:embedding AS vector)
        LIMIT :topK
        """, nativeQuery = true)
    List<Object[]> findNearest(
        @Param("embedding") String embedding,
        @Param("schemaVersion") String schemaVersion,
        @Param("topK") Integer topK
    );
}
