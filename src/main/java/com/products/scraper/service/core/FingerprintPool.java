package com.products.scraper.service.core;

import com.products.scraper.config.BrowserProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Rotation pool of plausible desktop browser fingerprints.
 * <p>
 * Best-effort only: it keeps requests from sharing one static identity, it
 * does not try to defeat real bot detection.
 */
@Slf4j
@Component
public class FingerprintPool {

    private static final String UA_LANG = "uk-UA,uk;q=0.9,en-US;q=0.8,en;q=0.7";

    /** Used when {@code browser.fingerprints} is empty. */
    static final List<Fingerprint> BUILT_IN = List.of(
            new Fingerprint("Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
                    + "(KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36", "uk-UA", UA_LANG, 1920, 1080),
            new Fingerprint("Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
                    + "(KHTML, like Gecko) Chrome/125.0.0.0 Safari/537.36 Edg/125.0.0.0", "uk-UA", UA_LANG, 1536, 864),
            new Fingerprint("Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/605.1.15 "
                    + "(KHTML, like Gecko) Version/17.4 Safari/605.1.15", "uk-UA", UA_LANG, 1440, 900),
            new Fingerprint("Mozilla/5.0 (X11; Linux x86_64; rv:126.0) Gecko/20100101 Firefox/126.0",
                    "en-US", "en-US,en;q=0.8,uk;q=0.6", 1366, 768)
    );

    private final List<Fingerprint> pool;

    @Autowired
    public FingerprintPool(final BrowserProperties props) {
        this(props.getFingerprints().stream()
                .filter(def -> StringUtils.isNotBlank(def.getUserAgent()))
                .map(def -> new Fingerprint(def.getUserAgent(), def.getLocale(), def.getAcceptLanguage(),
                        def.getViewportWidth(), def.getViewportHeight()))
                .toList());
    }

    public FingerprintPool(final List<Fingerprint> fingerprints) {
        this.pool = fingerprints == null || fingerprints.isEmpty() ? BUILT_IN : List.copyOf(fingerprints);
        log.info("Fingerprint pool holds {} identities", pool.size());
    }

    /**
     * @return a uniformly random fingerprint
     */
    public Fingerprint next() {
        return pool.get(ThreadLocalRandom.current().nextInt(pool.size()));
    }

    public List<Fingerprint> all() {
        return pool;
    }
}
