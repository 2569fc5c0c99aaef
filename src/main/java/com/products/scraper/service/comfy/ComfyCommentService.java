package com.products.scraper.service.comfy;

import com.fasterxml.jackson.databind.JsonNode;
import com.products.scraper.config.SourceCfg;
import com.products.scraper.config.SourceConfigFactory;
import com.products.scraper.model.Comment;
import com.products.scraper.model.NormalizedUrl;
import com.products.scraper.model.ProductRecords;
import com.products.scraper.model.RecordKind;
import com.products.scraper.model.SourceOptions;
import com.products.scraper.parser.ParseContext;
import com.products.scraper.parser.comfy.ComfyProductInfo;
import com.products.scraper.parser.comfy.ComfyReviewParser;
import com.products.scraper.service.core.FetcherFactory;
import com.products.scraper.service.core.PageRenderer;
import com.products.scraper.service.core.ProductSource;
import com.products.scraper.service.core.SourceSearchEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

import java.net.URI;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * <h2>Comfy review source</h2>
 *
 * <p>The product page is only served to real browsers, so it is rendered with
 * a {@link PageRenderer} to read the product id, store id and review total.
 * Reviews are then pulled from the paged JSON API:</p>
 * <pre>
 * GET {api-url}?productId=..&amp;storeId=..&amp;page=N&amp;pageSize=S&amp;type=1&amp;order=date&amp;parseCodes=1
 * </pre>
 * <p>with {@code S = max(1, reviewsTotal / 10)} and pages {@code 1..S}. A
 * page that fails or comes back empty is logged and skipped.</p>
 */
@Slf4j
@Service("comfyCommentSource")
@ConditionalOnProperty(prefix = "sources.configs.comfy", name = "enabled",
        havingValue = "true", matchIfMissing = true)
public class ComfyCommentService extends SourceSearchEngine implements ProductSource<Comment> {

    public static final String SOURCE_ID = "comfy";

    private final ComfyReviewParser parser;
    private final PageRenderer pageRenderer;

    @Autowired
    public ComfyCommentService(final ComfyReviewParser parser,
                               final PageRenderer pageRenderer,
                               final SourceConfigFactory configs,
                               final FetcherFactory fetchers,
                               final Clock clock) {
        this(parser, pageRenderer, configs.forSource(SOURCE_ID), fetchers, clock);
    }

    public ComfyCommentService(final ComfyReviewParser parser,
                               final PageRenderer pageRenderer,
                               final SourceCfg cfg,
                               final FetcherFactory fetchers,
                               final Clock clock) {
        super(SOURCE_ID, cfg, fetchers, clock);
        this.parser = parser;
        this.pageRenderer = pageRenderer;
    }

    @Override
    public RecordKind kind() {
        return RecordKind.COMMENTS;
    }

    @Override
    public ProductRecords<Comment> parse(final NormalizedUrl url, final SourceOptions options) {
        Optional<ComfyProductInfo> info = getFetcher()
                .loadPage(pageRenderer, url.canonicalUrl())
                .flatMap(ComfyProductInfo::fromPage);
        if (info.isEmpty()) {
            log.error("Could not read product id, store id or review total from {}", url.canonicalUrl());
            return ProductRecords.empty(url.canonicalUrl());
        }

        ComfyProductInfo product = info.get();
        int pageSize = product.pageSize();
        log.info("Comfy product {} (store {}) has {} reviews, fetching {} pages",
                product.productId(), product.storeId(), product.reviewsTotal(), pageSize);

        ParseContext context = new ParseContext(options.dateTo(), nowEpochSeconds());
        Map<String, Comment> comments = new LinkedHashMap<>();
        for (int page = 1; page <= pageSize; page++) {
            JsonNode reviews = getFetcher()
                    .getJson(pageUri(product, page, pageSize), Map.of())
                    .map(root -> root.path("reviews"))
                    .orElse(null);
            if (reviews == null || !reviews.isArray() || reviews.isEmpty()) {
                log.warn("No reviews on page {} of product {}", page, product.productId());
                continue;
            }
            comments.putAll(parser.parse(reviews, context));
        }
        log.info("Parsed {} comfy comments for {}", comments.size(), url.canonicalUrl());
        return new ProductRecords<>(url.canonicalUrl(), comments);
    }

    URI pageUri(final ComfyProductInfo product, final int page, final int pageSize) {
        MultiValueMap<String, String> q = new LinkedMultiValueMap<>();
        q.add("productId", product.productId());
        q.add("storeId", product.storeId());
        q.add("page", String.valueOf(page));
        q.add("pageSize", String.valueOf(pageSize));
        q.add("type", "1");
        q.add("order", "date");
        q.add("parseCodes", "1");
        return buildUri(getCfg().getApiUrl(), null, q);
    }
}
