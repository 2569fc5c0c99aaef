package com.products.scraper.service.comfy;

import com.products.scraper.config.SourceCfg;
import com.products.scraper.model.Comment;
import com.products.scraper.model.NormalizedUrl;
import com.products.scraper.model.ProductRecords;
import com.products.scraper.model.SourceOptions;
import com.products.scraper.parser.comfy.ComfyReviewParser;
import com.products.scraper.service.core.PageRenderer;
import com.products.scraper.service.core.SourceFixtures;
import com.products.scraper.util.DateUtils;
import com.products.scraper.util.UrlNormalizer;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ComfyCommentServiceTest {

    private static final String PRODUCT_URL = "https://comfy.ua/ua/smartfon-apple-iphone-15-128gb-black.html";
    private static final String CANONICAL = "https://comfy.ua/smartfon-apple-iphone-15-128gb-black.html";

    @Mock
    private PageRenderer renderer;

    private MockWebServer server;
    private ComfyCommentService service;
    private final List<RecordedRequest> apiCalls = new CopyOnWriteArrayList<>();
    private final Map<String, String> pages = new ConcurrentHashMap<>();

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(final RecordedRequest request) {
                apiCalls.add(request);
                String body = pages.getOrDefault(request.getRequestUrl().queryParameter("page"), "{\"reviews\":[]}");
                return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
            }
        });
        server.start();

        SourceCfg cfg = SourceFixtures.cfg("comfy.ua");
        cfg.setApiUrl(server.url("/api/reviews/paged").toString());
        cfg.setHeaders(Map.of("Cookie", "g_state={}"));
        service = new ComfyCommentService(new ComfyReviewParser(), renderer, cfg, SourceFixtures.fetchers(),
                Clock.fixed(Instant.parse("2024-04-01T00:00:00Z"), ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private void pageWithTotal(final int total) {
        when(renderer.render(eq(CANONICAL), any(), anyMap(), any())).thenReturn(
                "<script>{\"product\": {\"id\": 777, \"sku\": \"x\"}, \"storeId\": \"5\", \"reviewsTotal\": "
                        + total + "}</script>");
    }

    private static String review(final int id, final String date, final int rating) {
        return "{\"reviewId\":" + id + ",\"createdAt\":\"" + date + "\",\"productRating\":" + rating
                + ",\"advantages\":\"plus\",\"disadvantages\":\"\",\"detail\":\"review " + id + "\"}";
    }

    private ProductRecords<Comment> parse(final Long dateTo) {
        NormalizedUrl url = UrlNormalizer.normalize(PRODUCT_URL, "comfy.ua");
        return service.parse(url, SourceOptions.comments(dateTo));
    }

    @Test
    void shouldFetchEveryPageWithDerivedPageSize() {
        pageWithTotal(25);
        pages.put("1", "{\"reviews\":[" + review(1, "2024-03-01 10:00:00", 100) + ","
                + review(2, "2024-03-02 10:00:00", 60) + "]}");
        pages.put("2", "{\"reviews\":[" + review(3, "2024-03-03 10:00:00", 20) + "]}");

        ProductRecords<Comment> records = parse(null);

        assertThat(records.url()).isEqualTo(CANONICAL);
        assertThat(records.records().keySet()).containsExactly("1", "2", "3");
        assertThat(records.records().get("2").rating()).isEqualTo(3.0);
        assertThat(apiCalls).hasSize(2);

        RecordedRequest first = apiCalls.get(0);
        assertThat(first.getRequestUrl().queryParameter("productId")).isEqualTo("777");
        assertThat(first.getRequestUrl().queryParameter("storeId")).isEqualTo("5");
        assertThat(first.getRequestUrl().queryParameter("page")).isEqualTo("1");
        assertThat(first.getRequestUrl().queryParameter("pageSize")).isEqualTo("2");
        assertThat(first.getRequestUrl().queryParameter("type")).isEqualTo("1");
        assertThat(first.getRequestUrl().queryParameter("order")).isEqualTo("date");
        assertThat(first.getRequestUrl().queryParameter("parseCodes")).isEqualTo("1");
        assertThat(first.getHeader("Cookie")).isEqualTo("g_state={}");
        assertThat(first.getHeader("Referer")).isEqualTo("https://comfy.ua/");
    }

    @Test
    void shouldSkipEmptyPageAndContinue() {
        pageWithTotal(30);
        pages.put("1", "{\"reviews\":[" + review(1, "2024-03-01 10:00:00", 100) + "]}");
        pages.put("3", "{\"reviews\":[" + review(3, "2024-03-03 10:00:00", 80) + "]}");

        ProductRecords<Comment> records = parse(null);

        assertThat(records.records().keySet()).containsExactly("1", "3");
        assertThat(apiCalls).hasSize(3);
    }

    @Test
    void shouldApplyCutoff() {
        pageWithTotal(10);
        pages.put("1", "{\"reviews\":[" + review(1, "2024-03-01 10:00:00", 100) + ","
                + review(2, "2024-03-20 10:00:00", 100) + "]}");

        ProductRecords<Comment> records = parse(DateUtils.parseDateTo("2024-03-15"));

        assertThat(records.records().keySet()).containsExactly("1");
    }

    @Test
    void shouldReturnEmptyWhenPageLacksIdentifiers() {
        when(renderer.render(eq(CANONICAL), any(), anyMap(), any())).thenReturn("<html>no state here</html>");

        ProductRecords<Comment> records = parse(null);

        assertThat(records.isEmpty()).isTrue();
        assertThat(records.url()).isEqualTo(CANONICAL);
        assertThat(apiCalls).isEmpty();
    }
}
