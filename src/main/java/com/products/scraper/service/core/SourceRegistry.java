package com.products.scraper.service.core;

import com.products.scraper.model.RecordKind;
import com.products.scraper.util.UrlNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Registry of every active {@link ProductSource}.
 * Dispatch is by record kind and by the host of the incoming URL.
 */
@Slf4j
@Component
public class SourceRegistry {

    private final List<ProductSource<?>> sources;

    @Autowired
    public SourceRegistry(final List<ProductSource<?>> sources) {
        this.sources = List.copyOf(sources);
        log.info("Registered product sources: {}", sources.stream()
                .map(s -> s.id() + "(" + s.kind() + ")")
                .toList());
    }

    /**
     * Finds the adapter that handles {@code url} for {@code kind}.
     *
     * @param url  raw product URL
     * @param kind requested record kind
     * @param <T>  record type matching {@code kind}
     * @return the adapter, or empty when no configured domain matches
     */
    @SuppressWarnings("unchecked")
    public <T> Optional<ProductSource<T>> find(final String url, final RecordKind kind) {
        return sources.stream()
                .filter(s -> s.kind() == kind)
                .filter(s -> UrlNormalizer.belongsTo(url, s.domain()))
                .findFirst()
                .map(s -> (ProductSource<T>) s);
    }

    public List<ProductSource<?>> all() {
        return sources;
    }
}
