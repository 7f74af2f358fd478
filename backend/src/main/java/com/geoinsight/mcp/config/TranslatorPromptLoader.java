package com.geoinsight.mcp.config;

import com.geoinsight.mcp.service.QueryFingerprint;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Loads the translator prompt template from query-translator-prompt.md at startup.
 * The template hash is part of the parser identity, so editing the prompt retires
 * exact-match cache entries produced with the old one.
 */
@Component
@Slf4j
@Getter
public class TranslatorPromptLoader {

    static final String FALLBACK_TEMPLATE =
            "Translate the analytical request into a JSON object matching the structured query schema. "
            + "Respond with JSON only.\n\nRequest:\n{request}\n\nJSON:";

    private String template = FALLBACK_TEMPLATE;
    private String templateHash = QueryFingerprint.sha256(FALLBACK_TEMPLATE);

    @PostConstruct
    public void load() {
        try (InputStream is = getClass().getResourceAsStream("/query-translator-prompt.md")) {
            if (is == null) {
                log.warn("⚠️  query-translator-prompt.md not found, using built-in template");
                return;
            }
            template = new String(is.readAllBytes(), StandardCharsets.UTF_8);
            templateHash = QueryFingerprint.sha256(template);
            log.info("✅ Loaded translator prompt template (hash={})", templateHash.substring(0, 12));
        } catch (Exception e) {
            log.error("❌ Error loading query-translator-prompt.md: {}", e.getMessage(), e);
            template = FALLBACK_TEMPLATE;
            templateHash = QueryFingerprint.sha256(FALLBACK_TEMPLATE);
        }
    }

    public String render(String requestText) {
        return template.replace("{request}", requestText);
    }
}
