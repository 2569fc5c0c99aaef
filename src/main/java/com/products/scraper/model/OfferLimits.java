package com.products.scraper.model;

/**
 * Already-normalized bounds of one offer collection run.
 *
 * @param timeoutSeconds wall-clock budget measured from the start of enumeration
 * @param countLimit     maximum number of offers kept
 * @param sort           price order applied before truncation
 */
public record OfferLimits(int timeoutSeconds, int countLimit, PriceSort sort) {

    public OfferLimits {
        sort = sort == null ? PriceSort.NONE : sort;
    }
}
