package com.geoinsight.mcp.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Completion returned by the generation endpoint used for request translation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GenerateResponse {
    private String text;
    private String model;

    // "stop" or "length"; a length cut usually leaves the JSON object unterminated
    @JsonProperty("finish_reason")
    private String finishReason;
}
