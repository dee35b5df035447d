package dev.contractgate.core.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared Jackson mapper configuration for persisted documents.
 * <p>
 * Field names are written in snake_case and {@code java.time} values as ISO-8601 strings.
 */
public final class Mappers {

    private Mappers() {
    }

    /**
     * Create a YAML mapper for contracts, exemptions and conformance state.
     */
    public static ObjectMapper yaml() {
        YAMLFactory factory = YAMLFactory.builder()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
                .build();
        return configure(new ObjectMapper(factory));
    }

    /**
     * Create a JSON mapper for baselines, cache entries and SARIF output.
     */
    public static ObjectMapper json() {
        return configure(new ObjectMapper()).enable(SerializationFeature.INDENT_OUTPUT);
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        return mapper
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
