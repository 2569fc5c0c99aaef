package com.products.scraper.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.products.scraper.model.Offer;

/**
 * Public view of one offer.
 *
 * @param url         hotline conversion link
 * @param originalUrl resolved shop URL, {@code null} when unresolved
 * @param title       offer description
 * @param shop        shop name
 * @param price       price in UAH
 * @param used        second-hand flag
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OfferResponse(
        String url,
        String originalUrl,
        String title,
        String shop,
        double price,
        @JsonProperty("is_used") boolean used
) {

    public static OfferResponse from(final Offer offer) {
        return new OfferResponse(offer.url(), offer.originalUrl(), offer.title(),
                offer.shop(), offer.price(), offer.used());
    }
}
