package com.products.scraper.config;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Factory component responsible for producing {@link SourceCfg} instances
 * for a given source identifier. It delegates to {@link SourceProperties}
 * to look up the configuration section for each source as defined in
 * <code>application.yml</code>.
 *
 * <p>Usage:</p>
 * <pre>{@code
 * SourceCfg hotlineCfg = configFactory.forSource("hotline");
 * }</pre>
 */
@Component
@RequiredArgsConstructor
public class SourceConfigFactory {

    /**
     * Aggregated source configuration loaded from
     * <code>application.yml</code> under the <code>sources</code> namespace.
     */
    private final SourceProperties sourceProps;

    /**
     * Retrieves the {@link SourceCfg} for the specified source ID.
     *
     * @param id the source identifier (must match a key under
     *           <code>sources.configs.{id}</code> in application.yml)
     * @return the corresponding {@link SourceCfg} instance
     * @throws IllegalArgumentException if no configuration section is found
     *                                  for the given source ID
     */
    public SourceCfg forSource(final String id) {
        return Optional.ofNullable(sourceProps.forName(id))
                .orElseThrow(() -> new IllegalArgumentException(
                        "No <sources.configs." + id + "> section found in application.yml"));
    }

}
