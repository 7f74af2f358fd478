package com.geoinsight.mcp.client;

import com.geoinsight.mcp.model.StructuredQuery;

/**
 * External language model that turns free text into a {@link StructuredQuery}.
 * Any failure, including throttling, surfaces as
 * {@link com.geoinsight.mcp.exception.UpstreamUnavailableException}.
 */
public interface QueryTranslator {

    StructuredQuery translate(String requestText);
}
