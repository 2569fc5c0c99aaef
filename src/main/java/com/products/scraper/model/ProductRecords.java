package com.products.scraper.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Records of one product collected in a single run, keyed by their natural id.
 * <p>
 * Iteration order is the order the adapter emitted the records in (after any
 * sorting), and is what the HTTP projection returns.
 *
 * @param url     canonical product URL, or the raw input when validation failed
 * @param records id → record, immutable
 * @param <T>     {@link Offer} or {@link Comment}
 */
public record ProductRecords<T>(String url, Map<String, T> records) {

    public ProductRecords {
        records = records == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(records));
    }

    public static <T> ProductRecords<T> empty(final String url) {
        return new ProductRecords<>(url, Map.of());
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
