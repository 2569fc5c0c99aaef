package com.products.scraper.service.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.products.scraper.config.SourceCfg;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Creates one {@link ResilientFetcher} per source, all sharing the pooled
 * {@code scraperWebClient}, the retry registry and the fingerprint pool.
 */
@Component
public class FetcherFactory {

    private final WebClient webClient;
    private final ObjectMapper mapper;
    private final RetryRegistry retryRegistry;
    private final FingerprintPool fingerprints;

    public FetcherFactory(@Qualifier("scraperWebClient") final WebClient webClient,
                          @Qualifier("scraperObjectMapper") final ObjectMapper mapper,
                          final RetryRegistry retryRegistry,
                          final FingerprintPool fingerprints) {
        this.webClient = webClient;
        this.mapper = mapper;
        this.retryRegistry = retryRegistry;
        this.fingerprints = fingerprints;
    }

    public ResilientFetcher forSource(final String id, final SourceCfg cfg) {
        return new ResilientFetcher(id, cfg, webClient, mapper, retryRegistry, fingerprints);
    }
}
