package com.products.scraper.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class JacksonScraperConfig {

    /**
     * A dedicated {@link ObjectMapper} for the scraping layer.
     * <p>
     * • Injected by qualifier (<b>scraperObjectMapper</b>). Being the only mapper bean, it
     * also replaces the one Spring Boot would auto‑configure for MVC.<br>
     * • Tolerates unknown properties: shop APIs add fields without notice.<br>
     * • Also used to turn records into MongoDB documents.
     *
     * @return ObjectMapper for scraper
     */
    @Bean
    @Qualifier("scraperObjectMapper")
    public ObjectMapper scraperObjectMapper() {
        return newScraperObjectMapper();
    }

    /**
     * Wall clock used for {@code parsed_at} stamps and the collector deadline.
     *
     * @return the system UTC clock
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Builds the scraper mapper outside of a Spring context (tests, tools).
     *
     * @return a fresh, fully configured mapper
     */
    public static ObjectMapper newScraperObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

}
