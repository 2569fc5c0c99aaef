package com.products.scraper.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Key-wise overlay of a record map: entries of {@code incoming} replace
 * same-id entries of {@code existing}, everything else is kept.
 */
public final class RecordMerger {

    private RecordMerger() {
    }

    /**
     * @param existing stored records, may be {@code null}
     * @param incoming freshly parsed records, may be {@code null}
     * @param <V>      record value type
     * @return the merged map (existing order first, new ids appended), unmodifiable
     */
    public static <V> Map<String, V> merge(final Map<String, ? extends V> existing,
                                           final Map<String, ? extends V> incoming) {
        Map<String, V> merged = new LinkedHashMap<>();
        if (existing != null) {
            merged.putAll(existing);
        }
        if (incoming != null) {
            merged.putAll(incoming);
        }
        return Collections.unmodifiableMap(merged);
    }
}
