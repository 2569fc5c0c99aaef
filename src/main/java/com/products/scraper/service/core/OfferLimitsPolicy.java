package com.products.scraper.service.core;

import com.products.scraper.config.CollectorProperties;
import com.products.scraper.config.CollectorProperties.Bounds;
import com.products.scraper.model.OfferLimits;
import com.products.scraper.model.PriceSort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Turns the raw query parameters of the offers endpoint into {@link OfferLimits}.
 * <p>
 * Absent or non-integer values fall back to the configured default; integers
 * are clamped into the configured range. Values such as {@code "25.0"} are
 * accepted as integers, {@code "25.5"} is not.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OfferLimitsPolicy {

    private final CollectorProperties props;

    public OfferLimits resolve(final String timeoutLimit, final String countLimit, final String sort) {
        int timeout = normalize("timeout_limit", timeoutLimit, props.getTimeout());
        int count = normalize("count_limit", countLimit, props.getCount());
        return new OfferLimits(timeout, count, PriceSort.parse(sort));
    }

    int normalize(final String name, final String raw, final Bounds bounds) {
        if (StringUtils.isBlank(raw)) {
            return bounds.getDefaultValue();
        }
        Integer parsed = parseInteger(raw.trim());
        if (parsed == null) {
            log.warn("{}='{}' is not an integer, using default {}", name, raw, bounds.getDefaultValue());
            return bounds.getDefaultValue();
        }
        int clamped = bounds.clamp(parsed);
        if (clamped != parsed) {
            log.warn("{}={} out of range [{}, {}], clamped to {}",
                    name, parsed, bounds.getMin(), bounds.getMax(), clamped);
        }
        return clamped;
    }

    private static Integer parseInteger(final String raw) {
        try {
            BigDecimal value = new BigDecimal(raw);
            if (value.stripTrailingZeros().scale() > 0) {
                return null;
            }
            // far out of range still clamps to the nearest bound
            if (value.compareTo(BigDecimal.valueOf(Integer.MAX_VALUE)) > 0) {
                return Integer.MAX_VALUE;
            }
            if (value.compareTo(BigDecimal.valueOf(Integer.MIN_VALUE)) < 0) {
                return Integer.MIN_VALUE;
            }
            return value.intValueExact();
        } catch (NumberFormatException | ArithmeticException ex) {
            return null;
        }
    }
}
