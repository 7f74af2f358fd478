package com.geoinsight.mcp.client;

import com.geoinsight.mcp.config.QueryCacheProperties;
import com.geoinsight.mcp.exception.UpstreamUnavailableException;
import com.geoinsight.mcp.model.EmbedRequest;
import com.geoinsight.mcp.model.EmbedResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;

@Component
@Slf4j
public class EmbeddingApiClient implements EmbeddingClient {

    private final WebClient webClient;
    private final QueryCacheProperties properties;

    @Value("${mcp.embedding.url}")
    private String embedUrl;

    public EmbeddingApiClient(QueryCacheProperties properties) {
        this.properties = properties;
        this.webClient = WebClient.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(2 * 1024 * 1024))
                .build();
    }

    @Override
    public List<Double> embed(String text) {
        try {
            log.debug("Embedding request text: {}", text.substring(0, Math.min(50, text.length())));

            EmbedResponse response = webClient.post()
                    .uri(embedUrl)
                    .bodyValue(new EmbedRequest(text))
                    .retrieve()
                    .bodyToMono(EmbedResponse.class)
                    .timeout(Duration.ofMillis(properties.getEmbeddingTimeoutMs()))
                    .block();

            if (response == null || response.getEmbedding() == null || response.getEmbedding().isEmpty()) {
                throw new UpstreamUnavailableException("embedding service returned no vector");
            }

            log.debug("Embedding with {} dimensions ({})", response.getEmbedding().size(), response.getModel());
            return response.getEmbedding();

        } catch (UpstreamUnavailableException e) {
            throw e;
        } catch (Exception e) {
            log.warn("Embedding service unavailable: {}", e.getMessage());
            throw new UpstreamUnavailableException("embedding service unavailable: " + e.getMessage(), e);
        }
    }
}
