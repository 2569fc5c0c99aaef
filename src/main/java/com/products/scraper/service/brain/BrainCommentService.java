package com.products.scraper.service.brain;

import com.products.scraper.config.SourceCfg;
import com.products.scraper.config.SourceConfigFactory;
import com.products.scraper.model.Comment;
import com.products.scraper.model.NormalizedUrl;
import com.products.scraper.model.ProductRecords;
import com.products.scraper.model.RecordKind;
import com.products.scraper.model.SourceOptions;
import com.products.scraper.parser.ParseContext;
import com.products.scraper.parser.brain.BrainReviewParser;
import com.products.scraper.service.core.FetcherFactory;
import com.products.scraper.service.core.ProductSource;
import com.products.scraper.service.core.SourceSearchEngine;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Brain review source.
 * <p>
 * The numeric product id sits in the URL ({@code ...-p1234567.html}); the
 * comments endpoint returns all top-level comments as one rendered HTML
 * fragment under {@code commentsTpl}.
 */
@Slf4j
@Service("brainCommentSource")
@ConditionalOnProperty(prefix = "sources.configs.brain", name = "enabled",
        havingValue = "true", matchIfMissing = true)
public class BrainCommentService extends SourceSearchEngine implements ProductSource<Comment> {

    public static final String SOURCE_ID = "brain";

    static final Pattern PRODUCT_ID = Pattern.compile("-p(\\d+)\\.html");

    private final BrainReviewParser parser;

    @Autowired
    public BrainCommentService(final BrainReviewParser parser,
                               final SourceConfigFactory configs,
                               final FetcherFactory fetchers,
                               final Clock clock) {
        this(parser, configs.forSource(SOURCE_ID), fetchers, clock);
    }

    public BrainCommentService(final BrainReviewParser parser,
                               final SourceCfg cfg,
                               final FetcherFactory fetchers,
                               final Clock clock) {
        super(SOURCE_ID, cfg, fetchers, clock);
        this.parser = parser;
    }

    @Override
    public RecordKind kind() {
        return RecordKind.COMMENTS;
    }

    @Override
    public ProductRecords<Comment> parse(final NormalizedUrl url, final SourceOptions options) {
        String productId = productId(url.canonicalUrl());
        if (productId == null) {
            log.error("No product id in {}", url.canonicalUrl());
            return ProductRecords.empty(url.canonicalUrl());
        }

        String html = getFetcher()
                .getJson(buildUri(getCfg().getApiUrl(), productId, null), Map.of())
                .map(root -> root.path("commentsTpl").asText(""))
                .orElse("");
        if (StringUtils.isBlank(html)) {
            log.warn("No comments template for brain product {}", productId);
            return ProductRecords.empty(url.canonicalUrl());
        }

        Map<String, Comment> comments = parser.parse(html, new ParseContext(options.dateTo(), nowEpochSeconds()));
        log.info("Parsed {} brain comments for {}", comments.size(), url.canonicalUrl());
        return new ProductRecords<>(url.canonicalUrl(), comments);
    }

    static String productId(final String url) {
        Matcher m = PRODUCT_ID.matcher(url);
        return m.find() ? m.group(1) : null;
    }
}
