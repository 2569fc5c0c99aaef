package com.products.scraper.util;

import com.products.scraper.model.NormalizedUrl;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * <h2>UrlNormalizer</h2>
 *
 * <p>Validates that a product URL belongs to a shop domain and derives the
 * canonical form used as storage key:</p>
 * <ul>
 *   <li>scheme forced to {@code https}, host replaced by the bare domain,</li>
 *   <li>a leading language segment ({@code ua}, {@code ukr}, {@code en}, {@code ru}) dropped,</li>
 *   <li>query string and fragment dropped.</li>
 * </ul>
 *
 * <pre>{@code
 * normalize("https://hotline.ua/ua/mobile-apple-iphone-15/?tab=offers", "hotline.ua")
 *   → ("https://hotline.ua/mobile-apple-iphone-15", "/mobile-apple-iphone-15", "mobile-apple-iphone-15")
 * }</pre>
 *
 * <p>All methods are total: malformed input yields an invalid result, never an exception.</p>
 */
@Slf4j
public final class UrlNormalizer {

    /** Locale tokens the shops prepend to product paths. */
    public static final Set<String> LANG_PREFIXES = Set.of("ua", "ukr", "en", "ru");

    private static final String PATH_DELIMITER = "/";

    private UrlNormalizer() {
    }

    /**
     * @param url    raw product URL as received from the caller
     * @param domain shop domain, e.g. {@code comfy.ua}
     * @return the canonical triple, or {@link NormalizedUrl#invalid(String)}
     */
    public static NormalizedUrl normalize(final String url, final String domain) {
        if (StringUtils.isBlank(url)) {
            log.error("URL is empty");
            return NormalizedUrl.invalid(url);
        }

        UriComponents components = parse(url);
        if (components == null || !hostMatches(components.getHost(), domain)) {
            log.error("URL {} is not from {}", url, domain);
            return NormalizedUrl.invalid(url);
        }

        List<String> segments = new ArrayList<>();
        for (String part : StringUtils.defaultString(components.getPath()).split(PATH_DELIMITER)) {
            if (!part.isEmpty()) {
                segments.add(part);
            }
        }
        if (!segments.isEmpty() && LANG_PREFIXES.contains(segments.get(0).toLowerCase(Locale.ROOT))) {
            segments.remove(0);
        }

        String path = PATH_DELIMITER + String.join(PATH_DELIMITER, segments);
        String slug = segments.isEmpty() ? "" : stripExtension(segments.get(segments.size() - 1));
        String canonical = "https://" + domain + path;

        log.info("URL {} normalized to {} (path {}, slug {})", url, canonical, path, slug);
        return new NormalizedUrl(canonical, path, slug);
    }

    /**
     * Host check shared with source dispatch.
     *
     * @param url    raw URL
     * @param domain shop domain
     * @return {@code true} if the URL parses and its host ends with {@code domain}
     */
    public static boolean belongsTo(final String url, final String domain) {
        if (StringUtils.isBlank(url)) {
            return false;
        }
        UriComponents components = parse(url);
        return components != null && hostMatches(components.getHost(), domain);
    }

    private static boolean hostMatches(final String host, final String domain) {
        return StringUtils.isNotBlank(host)
                && StringUtils.isNotBlank(domain)
                && host.toLowerCase(Locale.ROOT).endsWith(domain.toLowerCase(Locale.ROOT));
    }

    private static UriComponents parse(final String url) {
        try {
            return UriComponentsBuilder.fromUriString(url.trim()).build();
        } catch (IllegalArgumentException ex) {
            log.warn("Unparsable URL {}: {}", url, ex.getMessage());
            return null;
        }
    }

    private static String stripExtension(final String segment) {
        int dot = segment.lastIndexOf('.');
        return dot > 0 ? segment.substring(0, dot) : segment;
    }
}
