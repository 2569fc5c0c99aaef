package com.products.scraper.service.hotline;

import com.fasterxml.jackson.databind.JsonNode;
import com.products.scraper.config.SourceCfg;
import com.products.scraper.config.SourceConfigFactory;
import com.products.scraper.model.NormalizedUrl;
import com.products.scraper.model.Offer;
import com.products.scraper.model.OfferLimits;
import com.products.scraper.model.ProductRecords;
import com.products.scraper.model.RecordKind;
import com.products.scraper.model.SourceOptions;
import com.products.scraper.parser.hotline.HotlineOfferParser;
import com.products.scraper.parser.hotline.OfferCandidate;
import com.products.scraper.service.core.FetcherFactory;
import com.products.scraper.service.core.ProductSource;
import com.products.scraper.service.core.SourceSearchEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <h2>Hotline offer source</h2>
 *
 * <p>Talks to hotline's frontend GraphQL API in two steps:</p>
 * <ol>
 *   <li>{@code urlTypeDefiner(path)} returns a session token for the product path;</li>
 *   <li>{@code getOffers(path: slug, first: countLimit, cityId)} returns the offer list,
 *       authorised by the {@code x-token} and {@code x-referer} headers.</li>
 * </ol>
 *
 * <p>Every offer's conversion link is then resolved to the shop URL it
 * redirects to, under the time and count budget of {@link BoundedCollector}.</p>
 */
@Slf4j
@Service("hotlineOfferSource")
@ConditionalOnProperty(prefix = "sources.configs.hotline", name = "enabled",
        havingValue = "true", matchIfMissing = true)
public class HotlineOfferService extends SourceSearchEngine implements ProductSource<Offer> {

    public static final String SOURCE_ID = "hotline";

    static final String TOKEN_QUERY = """
            query urlTypeDefiner($path: String!) {
              urlTypeDefiner(path: $path) {
                token
              }
            }
            """;

    static final String OFFERS_QUERY = """
            query getOffers($path: String!, $first: Int!, $cityId: Int!) {
              byPathQueryProduct(path: $path, cityId: $cityId) {
                offers(first: $first) {
                  edges {
                    node {
                      _id
                      conversionUrl
                      condition
                      conditionId
                      descriptionFull
                      firmTitle
                      price
                    }
                  }
                }
              }
            }
            """;

    private final HotlineOfferParser parser;

    @Autowired
    public HotlineOfferService(final HotlineOfferParser parser,
                               final SourceConfigFactory configs,
                               final FetcherFactory fetchers,
                               final Clock clock) {
        this(parser, configs.forSource(SOURCE_ID), fetchers, clock);
    }

    public HotlineOfferService(final HotlineOfferParser parser,
                               final SourceCfg cfg,
                               final FetcherFactory fetchers,
                               final Clock clock) {
        super(SOURCE_ID, cfg, fetchers, clock);
        this.parser = parser;
    }

    @Override
    public RecordKind kind() {
        return RecordKind.OFFERS;
    }

    @Override
    public ProductRecords<Offer> parse(final NormalizedUrl url, final SourceOptions options) {
        OfferLimits limits = Objects.requireNonNull(options.limits(), "offer limits");
        URI api = URI.create(getCfg().getApiUrl());

        String token = getFetcher()
                .postJson(api, graphQl("urlTypeDefiner", TOKEN_QUERY, Map.of("path", url.canonicalPath())), Map.of())
                .map(parser::token)
                .orElse(null);
        if (token == null) {
            log.warn("No hotline token for {}", url.canonicalPath());
            return ProductRecords.empty(url.canonicalUrl());
        }

        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("path", url.slug());
        variables.put("cityId", getCfg().getCityId());
        variables.put("first", limits.countLimit());

        Map<String, String> auth = Map.of(
                "x-token", token,
                "x-referer", url.canonicalUrl());

        List<OfferCandidate> candidates = getFetcher()
                .postJson(api, graphQl("getOffers", OFFERS_QUERY, variables), auth)
                .map(root -> parser.candidates(root, getCfg().getBaseUrl()))
                .orElse(List.of());
        if (candidates.isEmpty()) {
            log.warn("No hotline offers for {}", url.canonicalUrl());
            return ProductRecords.empty(url.canonicalUrl());
        }
        log.info("Hotline listed {} offers for {}, limits {}", candidates.size(), url.slug(), limits);

        long parsedAt = nowEpochSeconds();
        Map<String, Offer> offers = new BoundedCollector(getClock())
                .collect(candidates, c -> enrich(c, parsedAt), limits);
        return new ProductRecords<>(url.canonicalUrl(), offers);
    }

    private Offer enrich(final OfferCandidate candidate, final long parsedAt) {
        String originalUrl = getFetcher().resolveRedirect(candidate.url(), Map.of()).orElse(null);
        return new Offer(candidate.id(), candidate.url(), originalUrl, candidate.title(),
                candidate.shop(), candidate.price(), candidate.used(), parsedAt);
    }

    private static Map<String, Object> graphQl(final String operation,
                                               final String query,
                                               final Map<String, Object> variables) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("operationName", operation);
        body.put("variables", variables);
        body.put("query", query);
        return body;
    }
}
