package com.geoinsight.mcp.client;

import java.util.List;

/**
 * Text embedding service used for near-duplicate request search.
 */
public interface EmbeddingClient {

    /**
     * @throws com.geoinsight.mcp.exception.UpstreamUnavailableException when the service fails or times out
     */
    List<Double> embed(String text);
}
