package com.products.scraper.parser;

import java.util.Map;

/**
 * Converts a source-specific payload into records keyed by their source id.
 *
 * @param <P> payload type (JSON tree, HTML string)
 * @param <T> record type
 */
@FunctionalInterface
public interface RecordParser<P, T> {

    /**
     * @param payload raw source payload, may be {@code null}
     * @param context cutoff and fetch timestamp
     * @return records in payload order; may be empty but never {@code null}
     */
    Map<String, T> parse(P payload, ParseContext context);
}
