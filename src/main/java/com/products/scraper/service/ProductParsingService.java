package com.products.scraper.service;

import com.products.scraper.dto.ProductCommentsResponse;
import com.products.scraper.dto.ProductOffersResponse;
import com.products.scraper.model.Comment;
import com.products.scraper.model.NormalizedUrl;
import com.products.scraper.model.Offer;
import com.products.scraper.model.OfferLimits;
import com.products.scraper.model.ProductRecords;
import com.products.scraper.model.RecordKind;
import com.products.scraper.model.SourceOptions;
import com.products.scraper.service.core.OfferLimitsPolicy;
import com.products.scraper.service.core.ProductSource;
import com.products.scraper.service.core.SourceRegistry;
import com.products.scraper.store.MergeStore;
import com.products.scraper.util.DateUtils;
import com.products.scraper.util.UrlNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Entry point of one parse run: picks the source for the URL, normalises it,
 * runs the adapter, merges the result into the store and projects it for the
 * HTTP layer.
 * <p>
 * An unsupported domain or an invalid product URL is not an error: it yields
 * an empty result and nothing is written.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProductParsingService {

    private final SourceRegistry registry;
    private final OfferLimitsPolicy limitsPolicy;
    private final MergeStore store;

    public ProductOffersResponse offers(final String url,
                                        final String timeoutLimit,
                                        final String countLimit,
                                        final String sort) {
        OfferLimits limits = limitsPolicy.resolve(timeoutLimit, countLimit, sort);
        ProductRecords<Offer> records = run(url, RecordKind.OFFERS, SourceOptions.offers(limits));
        return ProductOffersResponse.from(records);
    }

    public ProductCommentsResponse comments(final String url, final String dateTo) {
        ProductRecords<Comment> records = run(url, RecordKind.COMMENTS,
                SourceOptions.comments(DateUtils.parseDateTo(dateTo)));
        return ProductCommentsResponse.from(records);
    }

    <T> ProductRecords<T> run(final String url, final RecordKind kind, final SourceOptions options) {
        Optional<ProductSource<T>> found = registry.find(url, kind);
        if (found.isEmpty()) {
            log.warn("No {} source for {}", kind.field(), url);
            return ProductRecords.empty(url);
        }
        ProductSource<T> source = found.get();

        NormalizedUrl normalized = UrlNormalizer.normalize(url, source.domain());
        if (!normalized.isValid()) {
            log.warn("Not a {} product URL: {}", source.id(), url);
            return ProductRecords.empty(normalized.canonicalUrl());
        }

        log.info("Parsing {} of {} via {}", kind.field(), normalized.canonicalUrl(), source.id());
        ProductRecords<T> records = source.parse(normalized, options);
        store.merge(records.url(), kind, records.records());
        return records;
    }
}
