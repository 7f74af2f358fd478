package com.geoinsight.mcp.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ResponseMetadata {

    private List<String> sources;

    @JsonProperty("generated_at")
    private Instant generatedAt;

    @JsonProperty("period_from")
    private LocalDate periodFrom;

    @JsonProperty("period_to")
    private LocalDate periodTo;

    private SpatialLevel level;

    /** Only set for results served from the periodically refreshed advanced-insight set. */
    @JsonProperty("last_refreshed_at")
    private Instant lastRefreshedAt;

    private List<String> warnings;
}
