package com.products.scraper.config;

import jakarta.validation.Valid;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Binds source-specific configuration from <code>application.yml</code>
 * under the <code>sources</code> prefix. Each entry in the bound map
 * corresponds to a {@link SourceCfg} object keyed by the source identifier.
 * <p>
 * Example YAML:
 * <pre>{@code
 * sources:
 *   configs:
 *     hotline:
 *       domain: hotline.ua
 *       api-url: https://hotline.ua/svc/frontend-api/graphql
 *       # ...
 *     brain:
 *       domain: brain.com.ua
 *       # ...
 * }</pre>
 */
@Validated
@Component
@ConfigurationProperties(prefix = "sources")
@Getter
@Setter
public class SourceProperties {

    /**
     * Map of source identifiers to their corresponding {@link SourceCfg}
     * instances, preserving insertion order.
     */
    private final Map<String, @Valid SourceCfg> configs = new LinkedHashMap<>();

    /**
     * Retrieves the {@link SourceCfg} for the given source name.
     *
     * @param name the source identifier
     * @return the {@link SourceCfg} associated with {@code name}, or {@code null}
     * if no such source is configured
     */
    public SourceCfg forName(final String name) {
        return configs.get(name);
    }

}
