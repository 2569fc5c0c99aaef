package com.products.scraper.parser.comfy;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Identifiers embedded in a rendered comfy.ua product page that the reviews
 * API needs.
 *
 * @param productId    comfy product id
 * @param storeId      store the product page belongs to
 * @param reviewsTotal number of reviews the page advertises
 */
public record ComfyProductInfo(String productId, String storeId, int reviewsTotal) {

    private static final Pattern PRODUCT_ID = Pattern.compile("\"product\":\\s*\\{\\s*\"id\":\\s*(\\d+)");
    private static final Pattern STORE_ID = Pattern.compile("\"storeId\":\\s*\"(\\d+)\"");
    private static final Pattern REVIEWS_TOTAL = Pattern.compile("\"reviewsTotal\":\\s*(\\d+)");

    /** Reviews per page the size formula divides by. */
    static final int REVIEWS_PER_PAGE_DIVISOR = 10;

    /**
     * Extracts the three identifiers from page HTML.
     *
     * @param html rendered page
     * @return info, or empty unless all three are present and the total is positive
     */
    public static Optional<ComfyProductInfo> fromPage(final String html) {
        if (html == null) {
            return Optional.empty();
        }
        String productId = firstGroup(PRODUCT_ID, html);
        String storeId = firstGroup(STORE_ID, html);
        String total = firstGroup(REVIEWS_TOTAL, html);
        if (productId == null || storeId == null || total == null) {
            return Optional.empty();
        }
        int reviewsTotal;
        try {
            reviewsTotal = Integer.parseInt(total);
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
        return reviewsTotal > 0
                ? Optional.of(new ComfyProductInfo(productId, storeId, reviewsTotal))
                : Optional.empty();
    }

    /**
     * Both the page count and the page size of the reviews API:
     * {@code max(1, reviewsTotal / 10)}.
     */
    public int pageSize() {
        return Math.max(1, reviewsTotal / REVIEWS_PER_PAGE_DIVISOR);
    }

    private static String firstGroup(final Pattern pattern, final String html) {
        Matcher m = pattern.matcher(html);
        return m.find() ? m.group(1) : null;
    }
}
