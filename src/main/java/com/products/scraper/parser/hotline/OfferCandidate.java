package com.products.scraper.parser.hotline;

/**
 * An offer as listed by hotline, before its conversion link is resolved.
 *
 * @param id    hotline offer id, {@code "unknown"} when absent
 * @param url   absolute conversion link without trailing slash
 * @param title offer description
 * @param shop  shop name
 * @param price listed price
 * @param used  second-hand flag
 */
public record OfferCandidate(String id, String url, String title, String shop, double price, boolean used) {
}
