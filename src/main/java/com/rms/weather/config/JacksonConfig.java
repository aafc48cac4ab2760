package com.rms.weather.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * The one {@link ObjectMapper} of the application: stream payload decoding,
 * API bodies and admin responses.
 */
@Configuration
public class JacksonConfig {

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return newObjectMapper();
    }

    /** Same settings as the bean, for code and tests outside the context. */
    public static ObjectMapper newObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();

        // LocalDate, Instant and Duration in ISO-8601 text.
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        return mapper;
    }
}
