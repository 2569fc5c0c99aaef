package com.products.scraper.model;

/**
 * Result of validating a product URL against a shop domain.
 * <p>
 * A failed validation keeps the raw input in {@code canonicalUrl} and leaves
 * {@code canonicalPath} and {@code slug} {@code null}.
 *
 * @param canonicalUrl  {@code https://{domain}/...} without language prefix, query or fragment
 * @param canonicalPath path starting with {@code /}
 * @param slug          last path segment without extension, {@code ""} for the root
 */
public record NormalizedUrl(String canonicalUrl, String canonicalPath, String slug) {

    public static NormalizedUrl invalid(final String rawUrl) {
        return new NormalizedUrl(rawUrl, null, null);
    }

    /**
     * @return {@code true} when the URL belongs to the domain and names a product page
     */
    public boolean isValid() {
        return canonicalPath != null && slug != null && !slug.isEmpty();
    }
}
