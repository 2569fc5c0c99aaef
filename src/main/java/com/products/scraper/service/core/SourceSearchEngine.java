package com.products.scraper.service.core;

import com.products.scraper.config.SourceCfg;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Clock;

/**
 * Common plumbing of the shop adapters: configuration, fetch layer, clock and
 * URI building.
 */
@Slf4j
@Getter
public abstract class SourceSearchEngine {

    private final String id;

    private final SourceCfg cfg;

    private final ResilientFetcher fetcher;

    private final Clock clock;

    protected SourceSearchEngine(final String id,
                                 final SourceCfg cfg,
                                 final FetcherFactory fetchers,
                                 final Clock clock) {
        this.id = id;
        this.cfg = cfg;
        this.fetcher = fetchers.forSource(id, cfg);
        this.clock = clock;
        log.info("Source '{}' bound to {}", id, cfg.getDomain());
    }

    public String id() {
        return id;
    }

    public String domain() {
        return cfg.getDomain();
    }

    /**
     * @return current time in epoch seconds, used as {@code parsed_at}
     */
    protected long nowEpochSeconds() {
        return clock.instant().getEpochSecond();
    }

    protected URI buildUri(@NonNull final String base,
                           @Nullable final String path,
                           @Nullable final MultiValueMap<String, String> q) {

        UriComponentsBuilder b = UriComponentsBuilder.fromUriString(base);

        if (StringUtils.isNotBlank(path)) {
            b.path(path.startsWith("/") || base.endsWith("/") ? path : "/" + path);
        }

        if (q != null && !q.isEmpty()) {
            b.queryParams(q);
        }
        return b.encode().build().toUri();
    }
}
