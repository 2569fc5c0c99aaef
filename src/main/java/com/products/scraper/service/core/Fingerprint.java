package com.products.scraper.service.core;

/**
 * Browser identity presented to a shop for one fetch.
 *
 * @param userAgent      {@code User-Agent} header / browser UA
 * @param locale         browser locale
 * @param acceptLanguage {@code Accept-Language} header
 * @param viewportWidth  viewport width in CSS pixels
 * @param viewportHeight viewport height in CSS pixels
 */
public record Fingerprint(
        String userAgent,
        String locale,
        String acceptLanguage,
        int viewportWidth,
        int viewportHeight
) {
}
