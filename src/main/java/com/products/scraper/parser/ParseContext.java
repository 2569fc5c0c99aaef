package com.products.scraper.parser;

/**
 * Per-run values every parsed record needs.
 *
 * @param dateTo   inclusive cutoff on creation time (epoch seconds), {@code null} for none
 * @param parsedAt epoch seconds stamped on every record of this run
 */
public record ParseContext(Long dateTo, long parsedAt) {

    public boolean accepts(final long createdAt) {
        return dateTo == null || createdAt <= dateTo;
    }
}
