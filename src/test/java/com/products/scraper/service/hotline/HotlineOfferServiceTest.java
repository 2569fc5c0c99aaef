package com.products.scraper.service.hotline;

import com.products.scraper.config.SourceCfg;
import com.products.scraper.model.NormalizedUrl;
import com.products.scraper.model.Offer;
import com.products.scraper.model.OfferLimits;
import com.products.scraper.model.PriceSort;
import com.products.scraper.model.ProductRecords;
import com.products.scraper.model.RecordKind;
import com.products.scraper.model.SourceOptions;
import com.products.scraper.parser.hotline.HotlineOfferParser;
import com.products.scraper.service.core.SourceFixtures;
import com.products.scraper.util.UrlNormalizer;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class HotlineOfferServiceTest {

    private static final String PRODUCT_URL = "https://hotline.ua/ua/mobile-apple-iphone-15/";
    private static final Instant NOW = Instant.parse("2024-03-15T10:00:00Z");

    private static final String OFFERS = """
            {"data":{"byPathQueryProduct":{"offers":{"edges":[
              {"node":{"_id":"1","conversionUrl":"/go/price/1/","conditionId":0,
                       "descriptionFull":"iPhone 15 black","firmTitle":"Shop 1","price":300}},
              {"node":{"_id":"2","conversionUrl":"/go/price/2/","conditionId":1,
                       "descriptionFull":"iPhone 15 used","firmTitle":"Shop 2","price":100}},
              {"node":{"_id":"3","conversionUrl":"/go/price/3/","conditionId":0,
                       "descriptionFull":"iPhone 15 blue","firmTitle":"Shop 3","price":200}}
            ]}}}}
            """;

    private MockWebServer server;
    private HotlineOfferService service;
    private final List<String> graphQlBodies = new CopyOnWriteArrayList<>();
    private volatile String token = "tok-1";

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(final RecordedRequest request) {
                String path = request.getPath();
                if ("POST".equals(request.getMethod()) && "/graphql".equals(path)) {
                    String body = request.getBody().readUtf8();
                    graphQlBodies.add(body);
                    if (body.contains("urlTypeDefiner")) {
                        String value = token == null ? "null" : "\"" + token + "\"";
                        return json("{\"data\":{\"urlTypeDefiner\":{\"token\":" + value + "}}}");
                    }
                    if (!"tok-1".equals(request.getHeader("x-token"))) {
                        return new MockResponse().setResponseCode(401);
                    }
                    return json(OFFERS);
                }
                if ("HEAD".equals(request.getMethod()) && path.startsWith("/go/price/")) {
                    if (path.endsWith("/3")) {
                        return new MockResponse().setResponseCode(200);
                    }
                    String id = path.substring("/go/price/".length());
                    return new MockResponse().setResponseCode(302)
                            .setHeader("Location", "https://shop-" + id + ".example/item");
                }
                return new MockResponse().setResponseCode(200);
            }
        });
        server.start();

        SourceCfg cfg = SourceFixtures.cfg("hotline.ua");
        cfg.setApiUrl(server.url("/graphql").toString());
        cfg.setBaseUrl(server.url("/").toString());
        service = new HotlineOfferService(new HotlineOfferParser(), cfg, SourceFixtures.fetchers(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private static MockResponse json(final String body) {
        return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
    }

    private ProductRecords<Offer> parse(final OfferLimits limits) {
        NormalizedUrl url = UrlNormalizer.normalize(PRODUCT_URL, "hotline.ua");
        return service.parse(url, SourceOptions.offers(limits));
    }

    @Test
    void shouldIdentifyItself() {
        assertThat(service.id()).isEqualTo("hotline");
        assertThat(service.domain()).isEqualTo("hotline.ua");
        assertThat(service.kind()).isEqualTo(RecordKind.OFFERS);
    }

    @Test
    void shouldCollectSortAndTruncateOffers() {
        ProductRecords<Offer> records = parse(new OfferLimits(60, 2, PriceSort.ASC));

        assertThat(records.url()).isEqualTo("https://hotline.ua/mobile-apple-iphone-15");
        assertThat(records.records().values()).extracting(Offer::id).containsExactly("2", "3");

        Offer cheapest = records.records().get("2");
        assertThat(cheapest.url()).isEqualTo(server.url("/go/price/2").toString());
        assertThat(cheapest.originalUrl()).isEqualTo("https://shop-2.example/item");
        assertThat(cheapest.used()).isTrue();
        assertThat(cheapest.shop()).isEqualTo("Shop 2");
        assertThat(cheapest.parsedAt()).isEqualTo(NOW.getEpochSecond());
    }

    @Test
    void shouldKeepOfferWhenRedirectCannotBeResolved() {
        ProductRecords<Offer> records = parse(new OfferLimits(60, 10, PriceSort.NONE));

        assertThat(records.records().keySet()).containsExactly("1", "2", "3");
        assertThat(records.records().get("3").originalUrl()).isNull();
        assertThat(records.records().get("1").originalUrl()).isEqualTo("https://shop-1.example/item");
    }

    @Test
    void shouldSendPathThenSlugToGraphQl() {
        parse(new OfferLimits(60, 25, PriceSort.NONE));

        assertThat(graphQlBodies).hasSize(2);
        assertThat(graphQlBodies.get(0))
                .contains("\"operationName\":\"urlTypeDefiner\"")
                .contains("\"path\":\"/mobile-apple-iphone-15\"");
        assertThat(graphQlBodies.get(1))
                .contains("\"operationName\":\"getOffers\"")
                .contains("\"path\":\"mobile-apple-iphone-15\"")
                .contains("\"cityId\":187")
                .contains("\"first\":25");
    }

    @Test
    void shouldReturnEmptyWithoutToken() {
        token = null;

        ProductRecords<Offer> records = parse(new OfferLimits(60, 10, PriceSort.NONE));

        assertThat(records.isEmpty()).isTrue();
        assertThat(records.url()).isEqualTo("https://hotline.ua/mobile-apple-iphone-15");
        assertThat(graphQlBodies).hasSize(1);
    }

    @Test
    void shouldReturnEmptyWhenApiIsDown() {
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(final RecordedRequest request) {
                return new MockResponse().setResponseCode(502);
            }
        });

        ProductRecords<Offer> records = parse(new OfferLimits(60, 10, PriceSort.NONE));

        assertThat(records.isEmpty()).isTrue();
    }

    @Test
    void shouldSortDescendingAndTruncate() {
        assertThat(parse(new OfferLimits(60, 10, PriceSort.DESC)).records().values())
                .extracting(Offer::price).containsExactly(300.0, 200.0, 100.0);
        assertThat(parse(new OfferLimits(60, 1, PriceSort.DESC)).records()).containsOnlyKeys("1");
    }
}
