package com.products.scraper.service.core;

import java.time.Duration;
import java.util.Map;

/**
 * Loads a page in a real browser engine and returns the rendered DOM.
 * Implementations throw on any navigation failure; retrying is the caller's job.
 */
@FunctionalInterface
public interface PageRenderer {

    /**
     * @param url               absolute page URL
     * @param fingerprint       identity to present
     * @param headers           extra request headers
     * @param navigationTimeout upper bound for reaching DOMContentLoaded
     * @return full page HTML
     */
    String render(String url, Fingerprint fingerprint, Map<String, String> headers, Duration navigationTimeout);
}
