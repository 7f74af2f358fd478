package com.geoinsight.mcp.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads the coarsest-level code directory (2-digit province code → province name)
 * from admin-sido-codes.json at startup.
 */
@Component
@Slf4j
public class AdminCodeDirectoryLoader {

    private static final String RESOURCE = "/admin-sido-codes.json";

    private Map<String, String> sidoNamesByCode = new LinkedHashMap<>();
    private final ObjectMapper objectMapper = new ObjectMapper();

    @PostConstruct
    public void load() {
        try (InputStream is = getClass().getResourceAsStream(RESOURCE)) {
            if (is == null) {
                log.error("❌ admin-sido-codes.json not found in classpath resources!");
                log.warn("⚠️  Coarsest level will resolve from admin_sig only");
                return;
            }

            Map<String, String> loaded = objectMapper.readValue(is, new TypeReference<LinkedHashMap<String, String>>() {});
            sidoNamesByCode = new LinkedHashMap<>(loaded);
            log.info("✅ Loaded {} province codes from admin-sido-codes.json", sidoNamesByCode.size());

        } catch (Exception e) {
            log.error("❌ Error loading admin-sido-codes.json: {}", e.getMessage(), e);
            log.warn("⚠️  Coarsest level will resolve from admin_sig only");
            sidoNamesByCode = new LinkedHashMap<>();
        }
    }

    public Map<String, String> getSidoNamesByCode() {
        return Collections.unmodifiableMap(sidoNamesByCode);
    }

    public boolean isLoaded() {
        return !sidoNamesByCode.isEmpty();
    }
}
