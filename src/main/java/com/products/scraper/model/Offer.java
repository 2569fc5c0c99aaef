package com.products.scraper.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * One shop offer of a hotline.ua product.
 *
 * @param id          hotline offer id, unique within the product's offer set
 * @param url         hotline conversion link ({@code https://hotline.ua/go/...})
 * @param originalUrl shop URL the conversion link redirects to, {@code null} if unresolved
 * @param title       offer description as listed by the shop
 * @param shop        shop (firm) name
 * @param price       price in UAH, never negative
 * @param used        {@code true} for second-hand goods
 * @param parsedAt    epoch seconds of the fetch that produced this record
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Offer(
        String id,
        String url,
        String originalUrl,
        String title,
        String shop,
        double price,
        @JsonProperty("is_used") boolean used,
        long parsedAt
) {

    public Offer {
        price = Math.max(0.0, price);
        title = title == null ? "" : title;
        shop = shop == null ? "" : shop;
    }
}
