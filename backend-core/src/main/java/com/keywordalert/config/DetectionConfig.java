package com.keywordalert.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.keywordalert.detection.FuzzyMatcher;
import com.keywordalert.detection.MatcherSettings;
import com.keywordalert.detection.ScriptEquivalenceTables;
import com.keywordalert.detection.TextNormalizer;
import com.keywordalert.exception.KeywordConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;

@Slf4j
@Configuration
public class DetectionConfig {

    @Bean
    public TextNormalizer textNormalizer(DetectionProperties properties, ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        return new TextNormalizer(loadTables(properties.equivalenceTables(), resourceLoader, objectMapper));
    }

    @Bean
    public FuzzyMatcher fuzzyMatcher(DetectionProperties properties, TextNormalizer textNormalizer) {
        try {
            return new FuzzyMatcher(properties.toMatcherSettings(textNormalizer));
        } catch (KeywordConfigurationException e) {
            log.error("Invalid matcher configuration, using built-in defaults. error={}", e.getMessage());
            return new FuzzyMatcher(MatcherSettings.defaults());
        }
    }

    static ScriptEquivalenceTables loadTables(String location, ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        try {
            ScriptEquivalenceTables tables = read(location, resourceLoader, objectMapper);
            log.info("Script equivalence tables loaded. location={}", location);
            return tables;
        } catch (KeywordConfigurationException | IOException e) {
            log.error("Failed to load script equivalence tables. location={}, error={}", location, e.getMessage());
        }
        if (!DetectionProperties.BUNDLED_EQUIVALENCE_TABLES.equals(location)) {
            try {
                return read(DetectionProperties.BUNDLED_EQUIVALENCE_TABLES, resourceLoader, objectMapper);
            } catch (KeywordConfigurationException | IOException e) {
                log.error("Failed to load bundled script equivalence tables. error={}", e.getMessage());
            }
        }
        log.warn("Running without script equivalence tables");
        return ScriptEquivalenceTables.empty();
    }

    private static ScriptEquivalenceTables read(String location, ResourceLoader resourceLoader, ObjectMapper objectMapper)
            throws IOException {
        Resource resource = resourceLoader.getResource(location);
        try (InputStream in = resource.getInputStream()) {
            return ScriptEquivalenceTables.read(in, objectMapper);
        }
    }
}
