package com.products.scraper.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.mongo.MongoClientSettingsBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Shortens MongoDB server selection so that an unreachable store is detected
 * within a request instead of after the driver's 30&nbsp;s default; the merge
 * step then skips persistence and the caller still gets its data.
 */
@Configuration
public class MongoConfiguration {

    @Bean
    public MongoClientSettingsBuilderCustomizer fastFailMongoCustomizer(
            @Value("${store.server-selection-timeout:2s}") final Duration selectionTimeout) {
        return builder -> builder
                .applyToClusterSettings(cluster -> cluster
                        .serverSelectionTimeout(selectionTimeout.toMillis(), TimeUnit.MILLISECONDS))
                .applyToSocketSettings(socket -> socket
                        .connectTimeout((int) selectionTimeout.toMillis(), TimeUnit.MILLISECONDS));
    }
}
