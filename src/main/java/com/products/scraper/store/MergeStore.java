package com.products.scraper.store;

import com.products.scraper.model.RecordKind;

import java.util.Map;

/**
 * Persistent per-product record maps with merge-on-write semantics.
 */
public interface MergeStore {

    /**
     * Merges {@code records} into the document stored for {@code url}, creating
     * it when absent. Records already stored and absent from {@code records}
     * are kept.
     *
     * @param url     canonical product URL, the document key
     * @param kind    which collection and field to write
     * @param records id → record
     * @return {@code true} when the write happened, {@code false} when it was
     * skipped because the store is unreachable or rejected it
     */
    boolean merge(String url, RecordKind kind, Map<String, ?> records);
}
