package com.geoinsight.mcp.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geoinsight.mcp.config.QueryCacheProperties;
import com.geoinsight.mcp.config.TranslatorPromptLoader;
import com.geoinsight.mcp.exception.UpstreamUnavailableException;
import com.geoinsight.mcp.model.GenerateRequest;
import com.geoinsight.mcp.model.GenerateResponse;
import com.geoinsight.mcp.model.StructuredQuery;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Translates a request through the generation endpoint with the prompt template from
 * {@link TranslatorPromptLoader}. Not retried: the call is the rate-limited resource the
 * semantic cache protects, and the caller falls back to the default scope instead.
 */
@Component
@Slf4j
public class LlmQueryTranslator implements QueryTranslator {

    private static final Pattern JSON_OBJECT = Pattern.compile("\\{.*\\}", Pattern.DOTALL);
    private static final int MAX_TOKENS = 512;

    private final WebClient webClient;
    private final QueryCacheProperties properties;
    private final TranslatorPromptLoader promptLoader;
    private final ObjectMapper objectMapper;

    @Value("${mcp.translator.url}")
    private String generateUrl;

    public LlmQueryTranslator(QueryCacheProperties properties, TranslatorPromptLoader promptLoader,
                              ObjectMapper objectMapper) {
        this.properties = properties;
        this.promptLoader = promptLoader;
        this.objectMapper = objectMapper;
        this.webClient = WebClient.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(2 * 1024 * 1024))
                .build();
    }

    @Override
    public StructuredQuery translate(String requestText) {
        GenerateRequest request = new GenerateRequest(
                properties.getParserModel(), promptLoader.render(requestText), MAX_TOKENS, 0.0, "json");
        String text;
        try {
            GenerateResponse response = webClient.post()
                    .uri(generateUrl)
                    .bodyValue(request)
                    .retrieve()
                    .bodyToMono(GenerateResponse.class)
                    .timeout(Duration.ofMillis(properties.getTranslatorTimeoutMs()))
                    .block();
            if (response == null || response.getText() == null || response.getText().isBlank()) {
                throw new UpstreamUnavailableException("translator returned an empty response");
            }
            if ("length".equals(response.getFinishReason())) {
                log.warn("⚠️  Translator output cut at {} tokens", MAX_TOKENS);
            }
            text = response.getText();
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                log.warn("⚠️  Translator rate limited (429)");
            } else {
                log.warn("⚠️  Translator returned HTTP {}", e.getStatusCode().value());
            }
            throw new UpstreamUnavailableException("translator unavailable: HTTP " + e.getStatusCode().value(), e);
        } catch (UpstreamUnavailableException e) {
            throw e;
        } catch (Exception e) {
            log.warn("⚠️  Translator call failed: {}", e.getMessage());
            throw new UpstreamUnavailableException("translator unavailable: " + e.getMessage(), e);
        }
        return parse(text);
    }

    StructuredQuery parse(String text) {
        Matcher matcher = JSON_OBJECT.matcher(text);
        if (!matcher.find()) {
            throw new UpstreamUnavailableException("translator output contains no JSON object");
        }
        try {
            return objectMapper.readValue(matcher.group(), StructuredQuery.class);
        } catch (JsonProcessingException e) {
            throw new UpstreamUnavailableException("translator output is not a structured query: "
                    + e.getOriginalMessage(), e);
        }
    }
}
