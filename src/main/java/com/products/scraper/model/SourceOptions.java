package com.products.scraper.model;

/**
 * Per-request options handed to a source adapter. Offer sources read
 * {@code limits}; comment sources read {@code dateTo}.
 *
 * @param limits collection bounds, {@code null} for comment sources
 * @param dateTo inclusive upper bound on {@code createdAt} in epoch seconds, {@code null} for none
 */
public record SourceOptions(OfferLimits limits, Long dateTo) {

    public static SourceOptions offers(final OfferLimits limits) {
        return new SourceOptions(limits, null);
    }

    public static SourceOptions comments(final Long dateTo) {
        return new SourceOptions(null, dateTo);
    }
}
