package com.products.scraper.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * <h2>Resilience4j Configuration</h2>
 *
 * <p>
 * Exposes the global {@link RetryRegistry} and the retry policy shared by all
 * source fetchers: a fixed number of attempts with a <em>linear</em> backoff
 * ({@code baseDelay × attempt}) and every failure considered retryable.
 * Each adapter registers its own named {@link Retry} built from its
 * {@link SourceCfg}.
 * </p>
 */
@Configuration
public class Resilience4jConfig {

    /**
     * Creates the global {@link RetryRegistry} which holds all configured
     * {@link Retry} instances.
     *
     * @return a registry pre‐populated with default retry configuration
     */
    @Bean
    public RetryRegistry retryRegistry() {
        return RetryRegistry.ofDefaults();
    }

    /**
     * Builds the fetch retry policy for one source.
     *
     * @param maxAttempts attempts including the first call; at least 1
     * @param baseDelay   wait after the first failure; later waits grow linearly
     * @return retry configuration retrying on any exception
     */
    public static RetryConfig linearBackoff(final int maxAttempts, final Duration baseDelay) {
        long baseMillis = Math.max(1L, baseDelay.toMillis());
        IntervalFunction linear = attempt -> baseMillis * attempt;
        return RetryConfig.custom()
                .maxAttempts(Math.max(1, maxAttempts))
                .intervalFunction(linear)
                .retryOnException(ex -> true)
                .build();
    }

    /**
     * Registers (or returns the already registered) fetch retry of a source.
     *
     * @param registry the global registry
     * @param name     retry name, usually the source id
     * @param cfg      source configuration carrying attempts and delay
     * @return the named {@link Retry}
     */
    public static Retry fetchRetry(final RetryRegistry registry, final String name, final SourceCfg cfg) {
        return registry.retry(name, linearBackoff(cfg.getMaxAttempts(), cfg.getRetryDelay()));
    }

}
