package com.products.scraper.model;

import java.util.Comparator;
import java.util.Locale;

/**
 * Requested ordering of collected offers.
 */
public enum PriceSort {

    NONE,
    ASC,
    DESC;

    /**
     * Lenient parse: anything other than {@code asc}/{@code desc}
     * (case-insensitive, blank included) means {@link #NONE}.
     *
     * @param raw request value, may be {@code null}
     * @return the matching order
     */
    public static PriceSort parse(final String raw) {
        if (raw == null) {
            return NONE;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "asc" -> ASC;
            case "desc" -> DESC;
            default -> NONE;
        };
    }

    public boolean isRequested() {
        return this != NONE;
    }

    /**
     * @return price comparator for this direction; {@code null} for {@link #NONE}
     */
    public Comparator<Offer> comparator() {
        return switch (this) {
            case ASC -> Comparator.comparingDouble(Offer::price);
            case DESC -> Comparator.comparingDouble(Offer::price).reversed();
            case NONE -> null;
        };
    }
}
