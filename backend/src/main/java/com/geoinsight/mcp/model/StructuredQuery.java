package com.geoinsight.mcp.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Machine-actionable form of a free-text analytical request.
 *
 * Bump {@link #SCHEMA_VERSION} whenever a field is added, removed or changes meaning: cached
 * mappings written under another version stop matching until they are regenerated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class StructuredQuery {

    public static final String SCHEMA_VERSION = "2";

    @Pattern(regexp = AnalyticalOperation.PATTERN, message = "unknown operation")
    private String operation;

    private String region;

    @JsonProperty("period_from")
    private String periodFrom;

    @JsonProperty("period_to")
    private String periodTo;

    private String period;

    private List<String> domains;

    private String domain;

    private String metric;

    @Min(1)
    @Max(100)
    @JsonProperty("top_k")
    private Integer topK;

    @Positive
    @JsonProperty("z_threshold")
    private Double anomalyThreshold;

    @Pattern(regexp = "finest|intermediate|coarsest|norm|emd|sig|sido", message = "unknown level")
    private String level;

    /** Default scope used when a request cannot be translated. */
    public static StructuredQuery empty() {
        return new StructuredQuery();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return operation == null && region == null && periodFrom == null && periodTo == null
                && period == null && domains == null && domain == null && metric == null
                && topK == null && anomalyThreshold == null && level == null;
    }

    /** Period of the single-period operations: period, else period_to, else period_from. */
    public String singlePeriod() {
        if (period != null) {
            return period;
        }
        return periodTo != null ? periodTo : periodFrom;
    }

    public String rangeFrom() {
        return periodFrom != null ? periodFrom : period;
    }

    public String rangeTo() {
        return periodTo != null ? periodTo : period;
    }

    /** Domains list, else the single domain, else null for every domain. */
    public List<String> domainList() {
        if (domains != null && !domains.isEmpty()) {
            return domains;
        }
        return domain != null ? List.of(domain) : null;
    }

    /** Metric to rank by; a population domain ranks by foot traffic. */
    public String rankingMetric() {
        if (metric != null) {
            return metric;
        }
        if (domain == null || "population".equalsIgnoreCase(domain)) {
            return "foot_traffic";
        }
        return domain;
    }

    /** Domain or metric name an anomaly check reads. */
    public String anomalyTarget() {
        return domain != null ? domain : metric;
    }
}
