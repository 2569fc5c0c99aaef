package com.products.scraper.service.hotline;

import com.products.scraper.model.Offer;
import com.products.scraper.model.OfferLimits;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Enriches offer candidates one by one under a time and a count budget.
 * <p>
 * Before each candidate the elapsed time since the start of the run is
 * checked; once the budget is spent, enumeration stops and what was collected
 * so far is returned. The check is advisory: a candidate already being
 * enriched is finished.
 * <p>
 * Without a price sort the run stops as soon as {@code countLimit} offers are
 * in hand. With a sort every candidate is enriched first, the result sorted
 * (stable, so equal prices keep listing order) and then truncated.
 */
@Slf4j
public final class BoundedCollector {

    private final Clock clock;

    public BoundedCollector(final Clock clock) {
        this.clock = clock;
    }

    /**
     * @param candidates listing order candidates
     * @param enrich     candidate → offer; {@code null} drops the candidate
     * @param limits     time and count budget, sort order
     * @param <C>        candidate type
     * @return offers keyed by id, in result order
     */
    public <C> Map<String, Offer> collect(final List<C> candidates,
                                          final Function<C, Offer> enrich,
                                          final OfferLimits limits) {
        Instant start = clock.instant();
        Duration budget = Duration.ofSeconds(limits.timeoutSeconds());
        boolean sorted = limits.sort().isRequested();

        Map<String, Offer> collected = new LinkedHashMap<>();
        for (C candidate : candidates) {
            Duration elapsed = Duration.between(start, clock.instant());
            if (limits.timeoutSeconds() > 0 && elapsed.compareTo(budget) >= 0) {
                log.warn("Offer collection stopped after {}s with {} of {} candidates",
                        elapsed.toSeconds(), collected.size(), candidates.size());
                break;
            }
            Offer offer = enrich.apply(candidate);
            if (offer != null) {
                collected.put(offer.id(), offer);
            }
            if (!sorted && collected.size() >= limits.countLimit()) {
                break;
            }
        }
        return finish(collected, limits);
    }

    private static Map<String, Offer> finish(final Map<String, Offer> collected, final OfferLimits limits) {
        List<Offer> offers = new ArrayList<>(collected.values());
        Comparator<Offer> order = limits.sort().comparator();
        if (order != null) {
            offers.sort(order);
        }
        Map<String, Offer> out = new LinkedHashMap<>();
        for (Offer offer : offers) {
            if (out.size() >= limits.countLimit()) {
                break;
            }
            out.put(offer.id(), offer);
        }
        return Collections.unmodifiableMap(out);
    }
}
