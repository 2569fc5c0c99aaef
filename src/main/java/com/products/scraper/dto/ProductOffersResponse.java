package com.products.scraper.dto;

import com.products.scraper.model.Offer;
import com.products.scraper.model.ProductRecords;

import java.util.List;

/**
 * Body of {@code GET /product/offers}.
 *
 * @param url    canonical product URL (raw input when it was not a valid product URL)
 * @param offers offers in result order
 */
public record ProductOffersResponse(String url, List<OfferResponse> offers) {

    public static ProductOffersResponse from(final ProductRecords<Offer> records) {
        return new ProductOffersResponse(records.url(),
                records.records().values().stream().map(OfferResponse::from).toList());
    }
}
