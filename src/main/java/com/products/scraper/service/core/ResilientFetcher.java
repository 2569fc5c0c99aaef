package com.products.scraper.service.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.products.scraper.config.Resilience4jConfig;
import com.products.scraper.config.SourceCfg;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Fetch layer of one source.
 * <p>
 * Every public call is retried by the source's {@link Retry} (fixed attempt
 * count, linear backoff) and never throws: exhaustion is logged and reported
 * as {@link Optional#empty()}. Transport errors, non-2xx statuses, empty or
 * undecodable bodies and challenge pages all count as failed attempts.
 */
@Slf4j
@Getter
public class ResilientFetcher {

    /** Upper bound of manually followed redirects per resolution attempt. */
    static final int MAX_REDIRECT_HOPS = 5;

    private final String name;
    private final SourceCfg cfg;
    private final WebClient webClient;
    private final ObjectMapper mapper;
    private final Retry retry;
    private final Retry redirectRetry;
    private final FingerprintPool fingerprints;

    public ResilientFetcher(final String name,
                            final SourceCfg cfg,
                            final WebClient webClient,
                            final ObjectMapper mapper,
                            final RetryRegistry registry,
                            final FingerprintPool fingerprints) {
        this.name = name;
        this.cfg = cfg;
        this.webClient = webClient;
        this.mapper = mapper;
        this.fingerprints = fingerprints;
        this.retry = Resilience4jConfig.fetchRetry(registry, name, cfg);
        // an unresolved redirect is a result, not an exception
        this.redirectRetry = registry.retry(name + "-redirect",
                RetryConfig.<String>from(retry.getRetryConfig())
                        .retryOnResult(Objects::isNull)
                        .build());
    }

    /**
     * GET {@code uri} and decode the body as JSON.
     *
     * @param uri     absolute request URI
     * @param headers per-call headers, applied after the source defaults
     * @return decoded body, or empty once all attempts failed
     */
    public Optional<JsonNode> getJson(final URI uri, final Map<String, String> headers) {
        return attempt(retry, "GET " + uri.getPath(), () -> {
            byte[] body = webClient.get()
                    .uri(uri)
                    .headers(h -> applyHeaders(h, headers))
                    .retrieve()
                    .bodyToMono(byte[].class)
                    .block(cfg.getTimeout());
            return toJson(body, uri);
        });
    }

    /**
     * POST a JSON {@code body} to {@code uri} and decode the answer as JSON.
     *
     * @param uri     absolute request URI
     * @param body    request payload, serialised with the scraper mapper
     * @param headers per-call headers, applied after the source defaults
     * @return decoded body, or empty once all attempts failed
     */
    public Optional<JsonNode> postJson(final URI uri, final Object body, final Map<String, String> headers) {
        return attempt(retry, "POST " + uri.getPath(), () -> {
            byte[] answer = webClient.post()
                    .uri(uri)
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(h -> applyHeaders(h, headers))
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(byte[].class)
                    .block(cfg.getTimeout());
            return toJson(answer, uri);
        });
    }

    /**
     * Renders {@code url} in a browser and returns its HTML. A page carrying the
     * configured challenge marker is treated as a failed attempt.
     *
     * @param renderer browser engine
     * @param url      absolute page URL
     * @return page HTML, or empty once all attempts failed
     */
    public Optional<String> loadPage(final PageRenderer renderer, final String url) {
        return attempt(retry, "page " + url, () -> {
            Fingerprint fp = fingerprints.next();
            Map<String, String> headers = new LinkedHashMap<>(defaultHeaders());
            headers.put(HttpHeaders.ACCEPT_LANGUAGE, fp.acceptLanguage());
            String html = renderer.render(url, fp, headers, cfg.getNavigationTimeout());
            if (html == null || html.isBlank()) {
                throw new IllegalStateException("empty page");
            }
            if (StringUtils.isNotBlank(cfg.getChallengeMarker()) && html.contains(cfg.getChallengeMarker())) {
                throw new IllegalStateException("anti-bot challenge page");
            }
            return html;
        });
    }

    /**
     * Resolves the final destination of a redirecting link.
     * <p>
     * A HEAD request is tried first and its {@code Location} taken; when that
     * yields nothing new, a GET is issued and the redirect chain followed hop by
     * hop. An attempt that ends on the input URL counts as a failure.
     *
     * @param url     link to resolve
     * @param headers per-call headers
     * @return the resolved URL, or empty once all attempts failed
     */
    public Optional<String> resolveRedirect(final String url, final Map<String, String> headers) {
        return attempt(redirectRetry, "redirect " + url, () -> {
            String location = nextLocation(HttpMethod.HEAD, url, headers);
            if (location == null || location.equals(url)) {
                location = followGet(url, headers);
            }
            return location == null || location.equals(url) ? null : location;
        });
    }

    /* ------------------------------------------------------------------ */

    private String followGet(final String url, final Map<String, String> headers) {
        String current = url;
        for (int hop = 0; hop < MAX_REDIRECT_HOPS; hop++) {
            String next = nextLocation(HttpMethod.GET, current, headers);
            if (next == null || next.equals(current)) {
                break;
            }
            current = next;
        }
        return current;
    }

    private String nextLocation(final HttpMethod method, final String url, final Map<String, String> headers) {
        URI target = URI.create(url);
        return webClient.method(method)
                .uri(target)
                .headers(h -> applyHeaders(h, headers))
                .exchangeToMono(resp -> {
                    URI location = resp.headers().asHttpHeaders().getLocation();
                    if (location == null) {
                        return resp.releaseBody().then(Mono.<String>empty());
                    }
                    return resp.releaseBody().thenReturn(target.resolve(location).toString());
                })
                .block(cfg.getTimeout());
    }

    private <T> Optional<T> attempt(final Retry policy, final String label, final Supplier<T> call) {
        int maxAttempts = policy.getRetryConfig().getMaxAttempts();
        AtomicInteger counter = new AtomicInteger();

        Supplier<T> logged = () -> {
            int n = counter.incrementAndGet();
            try {
                T result = call.get();
                if (result == null) {
                    log.warn("[{}] {} attempt {}/{} returned nothing", name, label, n, maxAttempts);
                }
                return result;
            } catch (RuntimeException ex) {
                log.warn("[{}] {} attempt {}/{} failed: {}", name, label, n, maxAttempts, ex.toString());
                throw ex;
            }
        };

        try {
            T result = Retry.decorateSupplier(policy, logged).get();
            if (result == null) {
                log.error("[{}] {} gave up after {} attempts", name, label, counter.get());
            }
            return Optional.ofNullable(result);
        } catch (RuntimeException ex) {
            log.error("[{}] {} gave up after {} attempts: {}", name, label, counter.get(), ex.toString());
            return Optional.empty();
        }
    }

    private void applyHeaders(final HttpHeaders h, final Map<String, String> extra) {
        Fingerprint fp = fingerprints.next();
        h.set(HttpHeaders.USER_AGENT, fp.userAgent());
        h.set(HttpHeaders.ACCEPT_LANGUAGE, fp.acceptLanguage());
        defaultHeaders().forEach(h::set);
        if (extra != null) {
            extra.forEach(h::set);
        }
    }

    private Map<String, String> defaultHeaders() {
        Map<String, String> headers = new LinkedHashMap<>();
        if (StringUtils.isNotBlank(cfg.getReferer())) {
            headers.put(HttpHeaders.REFERER, cfg.getReferer());
        }
        if (cfg.getHeaders() != null) {
            headers.putAll(cfg.getHeaders());
        }
        return headers;
    }

    private JsonNode toJson(final byte[] bytes, final URI uri) {
        if (bytes == null || bytes.length == 0) {
            throw new IllegalStateException("empty body from " + uri.getPath());
        }
        try {
            return mapper.readTree(bytes);
        } catch (IOException ex) {
            throw new UncheckedIOException("JSON parse error for " + uri.getPath(), ex);
        }
    }
}
