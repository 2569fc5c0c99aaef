package com.products.scraper.config;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * <h2>{@code BrowserProperties}</h2>
 *
 * <p>Binds the <code>browser</code> section of {@code application.yml}: how the
 * headless Chromium is launched, which sub-resources are aborted, and the pool
 * of browser fingerprints rotated across requests.</p>
 *
 * <p>The fingerprint pool is shared by plain HTTP calls (user agent and
 * accept-language only) and by browser contexts (all fields).</p>
 */
@Data
@Component
@ConfigurationProperties(prefix = "browser")
public class BrowserProperties {

    /** Launch Chromium without a window. */
    private boolean headless = true;

    /** Extra command-line switches passed to Chromium. */
    private List<String> launchArgs = new ArrayList<>(List.of(
            "--disable-blink-features=AutomationControlled",
            "--no-sandbox",
            "--disable-dev-shm-usage",
            "--disable-gpu",
            "--disable-infobars",
            "--disable-extensions"
    ));

    /** Playwright resource types aborted before they hit the network. */
    private List<String> blockedResourceTypes = new ArrayList<>(List.of(
            "image", "font", "media", "stylesheet"));

    /** Rotation pool; an empty list falls back to the built-in pool. */
    private List<FingerprintDef> fingerprints = new ArrayList<>();

    /**
     * One YAML row of the fingerprint pool.
     */
    @Data
    @NoArgsConstructor
    public static class FingerprintDef {

        /** Full {@code User-Agent} string. */
        private String userAgent;

        /** Browser locale, e.g. <code>uk-UA</code>. */
        private String locale = "uk-UA";

        /** {@code Accept-Language} header value. */
        private String acceptLanguage = "uk-UA,uk;q=0.9,en-US;q=0.8,en;q=0.7";

        /** Viewport width in CSS pixels. */
        private int viewportWidth = 1920;

        /** Viewport height in CSS pixels. */
        private int viewportHeight = 1080;
    }
}
