package com.products.scraper.service.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.products.scraper.config.JacksonScraperConfig;
import com.products.scraper.config.SourceCfg;
import com.products.scraper.config.WebClientConfiguration;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;

/**
 * Production wiring of the fetch layer with test-friendly retry timings.
 */
public final class SourceFixtures {

    private SourceFixtures() {
    }

    public static SourceCfg cfg(final String domain) {
        SourceCfg cfg = new SourceCfg();
        cfg.setDomain(domain);
        cfg.setBaseUrl("https://" + domain);
        cfg.setReferer("https://" + domain + "/");
        cfg.setMaxAttempts(3);
        cfg.setRetryDelay(Duration.ofMillis(1));
        cfg.setTimeout(Duration.ofSeconds(5));
        return cfg;
    }

    public static FetcherFactory fetchers() {
        ObjectMapper mapper = JacksonScraperConfig.newScraperObjectMapper();
        WebClient webClient = WebClientConfiguration.configure(WebClient.builder(), mapper).build();
        return new FetcherFactory(webClient, mapper, RetryRegistry.ofDefaults(), new FingerprintPool(List.of()));
    }
}
