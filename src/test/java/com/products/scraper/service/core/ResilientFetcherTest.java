package com.products.scraper.service.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.products.scraper.config.SourceCfg;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ResilientFetcherTest {

    private MockWebServer server;
    private ResilientFetcher fetcher;
    private SourceCfg cfg;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        cfg = SourceFixtures.cfg("hotline.ua");
        cfg.setHeaders(Map.of("Cookie", "g_state={}"));
        fetcher = SourceFixtures.fetchers().forSource("test", cfg);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private URI uri(final String path) {
        return server.url(path).uri();
    }

    private static MockResponse json(final String body) {
        return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
    }

    @Test
    void shouldGiveUpAfterThreeFailedAttempts() {
        for (int i = 0; i < 3; i++) {
            server.enqueue(new MockResponse().setResponseCode(500));
        }

        Optional<JsonNode> result = fetcher.getJson(uri("/api"), Map.of());

        assertThat(result).isEmpty();
        assertThat(server.getRequestCount()).isEqualTo(3);
    }

    @Test
    void shouldSucceedAfterTransientFailures() {
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(json("not json {"));
        server.enqueue(json("{\"ok\":true}"));

        Optional<JsonNode> result = fetcher.getJson(uri("/api"), Map.of());

        assertThat(result).isPresent();
        assertThat(result.get().path("ok").asBoolean()).isTrue();
        assertThat(server.getRequestCount()).isEqualTo(3);
    }

    @Test
    void shouldTreatEmptyBodyAsFailure() {
        for (int i = 0; i < 3; i++) {
            server.enqueue(new MockResponse().setResponseCode(200));
        }

        assertThat(fetcher.getJson(uri("/api"), Map.of())).isEmpty();
        assertThat(server.getRequestCount()).isEqualTo(3);
    }

    @Test
    void shouldSendSourceAndCallHeaders() throws InterruptedException {
        server.enqueue(json("{\"data\":{}}"));

        fetcher.postJson(uri("/graphql"), Map.of("operationName", "getOffers"), Map.of("x-token", "t-1"));

        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getHeader("x-token")).isEqualTo("t-1");
        assertThat(request.getHeader("Referer")).isEqualTo("https://hotline.ua/");
        assertThat(request.getHeader("Cookie")).isEqualTo("g_state={}");
        assertThat(request.getHeader("User-Agent")).startsWith("Mozilla/5.0");
        assertThat(request.getHeader("Accept-Language")).isNotBlank();
        assertThat(request.getBody().readUtf8()).contains("\"operationName\":\"getOffers\"");
    }

    @Test
    void shouldResolveRedirectFromHeadLocation() {
        server.enqueue(new MockResponse().setResponseCode(302).setHeader("Location", "/shop/item-1"));

        Optional<String> resolved = fetcher.resolveRedirect(server.url("/go/price/1").toString(), Map.of());

        assertThat(resolved).contains(server.url("/shop/item-1").toString());
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void shouldFollowGetChainWhenHeadHasNoLocation() throws InterruptedException {
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(final RecordedRequest request) {
                String key = request.getMethod() + " " + request.getPath();
                return switch (key) {
                    case "GET /go/price/2" -> new MockResponse().setResponseCode(302).setHeader("Location", "/hop");
                    case "GET /hop" -> new MockResponse().setResponseCode(301).setHeader("Location", "/final");
                    default -> new MockResponse().setResponseCode(200);
                };
            }
        });

        Optional<String> resolved = fetcher.resolveRedirect(server.url("/go/price/2").toString(), Map.of());

        assertThat(resolved).contains(server.url("/final").toString());
        assertThat(server.takeRequest().getMethod()).isEqualTo("HEAD");
    }

    @Test
    void shouldReportUnresolvedRedirectAsEmpty() {
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(final RecordedRequest request) {
                return new MockResponse().setResponseCode(200);
            }
        });

        Optional<String> resolved = fetcher.resolveRedirect(server.url("/go/price/3").toString(), Map.of());

        assertThat(resolved).isEmpty();
        // HEAD + GET per attempt
        assertThat(server.getRequestCount()).isEqualTo(6);
    }

    @Test
    void shouldRetryChallengePages() {
        PageRenderer renderer = mock(PageRenderer.class);
        when(renderer.render(eq("https://comfy.ua/p"), any(Fingerprint.class), anyMap(), any(Duration.class)))
                .thenReturn("<html><title>Pardon Our Interruption</title></html>")
                .thenReturn("<html>real page</html>");

        Optional<String> page = fetcher.loadPage(renderer, "https://comfy.ua/p");

        assertThat(page).contains("<html>real page</html>");
        verify(renderer, times(2)).render(eq("https://comfy.ua/p"), any(Fingerprint.class), anyMap(), any(Duration.class));
    }

    @Test
    void shouldGiveUpOnPersistentRendererFailures() {
        PageRenderer renderer = mock(PageRenderer.class);
        when(renderer.render(any(), any(), anyMap(), any())).thenThrow(new IllegalStateException("timeout"));

        assertThat(fetcher.loadPage(renderer, "https://comfy.ua/p")).isEmpty();
        verify(renderer, times(3)).render(any(), any(), anyMap(), any());
    }
}
