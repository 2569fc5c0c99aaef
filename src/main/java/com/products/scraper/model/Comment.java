package com.products.scraper.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * One customer review.
 *
 * @param id           review id assigned by the shop
 * @param rating       0&ndash;5 stars
 * @param advantages   plain-text "pros" section, may be empty
 * @param shortcomings plain-text "cons" section, may be empty
 * @param comment      plain-text review body
 * @param createdAt    epoch seconds of the review date (shop-local, naive)
 * @param parsedAt     epoch seconds of the fetch that produced this record
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Comment(
        String id,
        double rating,
        String advantages,
        String shortcomings,
        String comment,
        long createdAt,
        long parsedAt
) {

    /** Upper bound of the canonical rating scale. */
    public static final double MAX_RATING = 5.0;

    public Comment {
        rating = Math.max(0.0, Math.min(MAX_RATING, rating));
        advantages = advantages == null ? "" : advantages;
        shortcomings = shortcomings == null ? "" : shortcomings;
        comment = comment == null ? "" : comment;
    }
}
