package com.geoinsight.mcp.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * How a free-text request was mapped to a structured query.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CacheResolution {

    private CacheOutcome outcome;

    @JsonProperty("structured_query")
    private StructuredQuery structuredQuery;

    private String fingerprint;

    /** Entry served on a near hit. */
    @JsonProperty("matched_fingerprint")
    private String matchedFingerprint;

    /** Cosine distance to the matched entry on a near hit. */
    private Double distance;

    /** True when translation failed and the default scope was used. */
    private boolean fallback;

    @JsonProperty("translator_error")
    private String translatorError;

    private boolean retryable;
}
