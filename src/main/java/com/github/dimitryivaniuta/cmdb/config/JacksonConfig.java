package com.github.dimitryivaniuta.cmdb.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

/**
 * Central Jackson configuration for:
 * - ISO-8601 timestamps in API envelopes and jsonb columns
 * - lenient parsing of n8n payloads (the engine adds fields between releases)
 * - canonical output for report cache keys
 */
@Configuration
public class JacksonConfig {

    @Bean
    public ObjectMapper objectMapper(Jackson2ObjectMapperBuilder builder) {
        return builder
                .createXmlMapper(false)
                .modulesToInstall(new JavaTimeModule())
                .serializationInclusion(JsonInclude.Include.NON_NULL)
                .featuresToDisable(
                        SerializationFeature.WRITE_DATES_AS_TIMESTAMPS,
                        DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                // cache keys hash the serialized parameters
                .featuresToEnable(
                        MapperFeature.SORT_PROPERTIES_ALPHABETICALLY,
                        SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS,
                        MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS,
                        DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .build();
    }
}
