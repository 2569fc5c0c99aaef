package com.products.scraper.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Defaults and bounds applied to the offer-collection parameters of
 * <code>GET /product/offers</code>.
 *
 * <p>Example structure:</p>
 * <pre>
 * collector:
 *   timeout:
 *     default-value: 60
 *     min: 10
 *     max: 60
 *   count:
 *     default-value: 10
 *     min: 10
 *     max: 1000
 * </pre>
 */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "collector")
public class CollectorProperties {

    /** Wall-clock budget of one collection run, in seconds. */
    @Valid
    @NotNull
    private Bounds timeout = new Bounds(60, 10, 60);

    /** Maximum number of offers returned by one run. */
    @Valid
    @NotNull
    private Bounds count = new Bounds(10, 10, 1000);

    /**
     * Default value plus inclusive clamp range of one integer parameter.
     */
    @Data
    public static class Bounds {
        /** Used when the parameter is absent or not an integer. */
        private int defaultValue;
        /** Lower clamp. */
        @Min(1)
        private int min;
        /** Upper clamp. */
        private int max;

        public Bounds() {
        }

        public Bounds(final int defaultValue, final int min, final int max) {
            this.defaultValue = defaultValue;
            this.min = min;
            this.max = max;
        }

        /**
         * Clamps {@code value} into {@code [min, max]}.
         *
         * @param value raw integer
         * @return the clamped value
         */
        public int clamp(final int value) {
            return Math.max(min, Math.min(max, value));
        }
    }
}
