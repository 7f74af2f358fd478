package com.geoinsight.mcp.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;

/**
 * Semantic cache row: request fingerprint → structured query, searchable by embedding distance.
 * Only updatedAt changes for a live entry; the structured query is rewritten only when the
 * entry was produced under an older schema version.
 */
@Entity
@Table(name = "query_mapping_cache", indexes = {
    @Index(name = "idx_query_mapping_version", columnList = "schema_version,parser_model")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class QueryMappingEntry {

    // sha-256 of (normalized text, parser identity, schema version)
    @Id
    @Column(name = "request_hash", length = 64)
    private String requestHash;

    @Column(name = "request_text", columnDefinition = "TEXT", nullable = false)
    private String requestText;

    @Column(name = "parser_model", nullable = false)
    private String parserModel;

    @Column(name = "parser_template_hash", nullable = false)
    private String parserTemplateHash;

    @Column(name = "schema_version", nullable = false)
    private String schemaVersion;

    @Column(name = "query_json", columnDefinition = "jsonb", nullable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    private StructuredQuery structuredQuery;

    @Column(name = "embedding", columnDefinition = "vector(1024)")
    private String embedding;  // pgvector literal "[0.1,0.2,...]", null when the embedder was down

    // Fingerprint of the entry this one was aliased from on a near hit
    @Column(name = "alias_of", length = 64)
    private String aliasOf;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
