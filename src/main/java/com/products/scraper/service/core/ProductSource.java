package com.products.scraper.service.core;

import com.products.scraper.model.NormalizedUrl;
import com.products.scraper.model.ProductRecords;
import com.products.scraper.model.RecordKind;
import com.products.scraper.model.SourceOptions;

/**
 * One shop adapter producing a single kind of record.
 *
 * @param <T> record type, {@code Offer} or {@code Comment}
 */
public interface ProductSource<T> {

    /**
     * @return source identifier, e.g. {@code hotline}
     */
    String id();

    /**
     * @return domain accepted product URLs must belong to
     */
    String domain();

    /**
     * @return the kind of record this adapter returns
     */
    RecordKind kind();

    /**
     * Fetches and parses all records of one product.
     * <p>
     * Never throws for source-side trouble: unreachable endpoints, missing
     * identifiers or malformed payloads all yield an empty result keyed by the
     * canonical URL.
     *
     * @param url     validated, normalised product URL
     * @param options offer limits or review cutoff
     * @return records keyed by their source id
     */
    ProductRecords<T> parse(NormalizedUrl url, SourceOptions options);
}
