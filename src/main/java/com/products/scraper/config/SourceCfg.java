package com.products.scraper.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Holds configuration properties for one shop source.
 * <p>
 * Each instance encapsulates the domain that product URLs must belong to,
 * the endpoints the adapter talks to, and the retry policy of the
 * fetch layer for that shop.
 * </p>
 */
@Getter
@Setter
public class SourceCfg {

    /**
     * Domain every accepted product URL must end with.
     * <p>For example, "hotline.ua".</p>
     */
    @NotBlank(message = "sources.configs.*.domain must be set")
    private String domain;

    /**
     * Site root used to resolve relative links found in payloads.
     * <p>For example, "https://hotline.ua".</p>
     */
    private String baseUrl;

    /**
     * Absolute endpoint of the source API.
     * <p>For example, "https://hotline.ua/svc/frontend-api/graphql" or
     * "https://brain.com.ua/api/v1/product_comments/".</p>
     */
    private String apiUrl;

    /**
     * Value of the {@code Referer} header sent with every request.
     */
    private String referer;

    /**
     * Extra headers sent with every request to this source.
     */
    private Map<String, String> headers = new LinkedHashMap<>();

    /**
     * Whether the adapter bean should be active.
     */
    private boolean enabled = true;

    /**
     * Attempts per fetch before giving up (first call included).
     */
    @Min(1)
    private int maxAttempts = 3;

    /**
     * Base delay of the linear backoff: attempt {@code n} waits {@code n × retryDelay}.
     */
    private Duration retryDelay = Duration.ofMillis(300);

    /**
     * Blocking timeout of one HTTP exchange.
     */
    private Duration timeout = Duration.ofSeconds(10);

    /**
     * Navigation timeout of a browser page load.
     */
    private Duration navigationTimeout = Duration.ofSeconds(5);

    /**
     * Text whose presence marks an anti-bot interstitial instead of the real page.
     */
    private String challengeMarker = "Pardon Our Interruption";

    /**
     * City used for regional offer lists (hotline only).
     */
    private int cityId = 187;
}
