package com.criterion.demo.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.time.Instant;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration for the demo, bound from the {@code criterion.demo.*} prefix:
 *
 * <pre>
 * criterion:
 *   demo:
 *     interactive: true
 *     reference-time: 2025-06-15T12:00:00Z
 *     domestic-country: USA
 *     sample-data: classpath:sample-data/warehouse.json
 *     cycle-count-days: 30
 *     expiring-days: 30
 * </pre>
 *
 * @param interactive run the menu on stdin/stdout instead of every scenario once
 * @param referenceTime instant the time-based rules treat as "now"; null means the system clock
 * @param domesticCountry destination that does not count as international
 * @param sampleData Spring resource location of the warehouse JSON
 * @param cycleCountDays days after which stock needs a cycle count
 * @param expiringDays look-ahead window for expiring products
 */
@ConfigurationProperties(prefix = "criterion.demo")
@Validated
public record DemoProperties(
        boolean interactive,
        Instant referenceTime,
        @NotBlank String domesticCountry,
        @NotBlank String sampleData,
        @Positive int cycleCountDays,
        @Positive int expiringDays) {

    public static final String DEFAULT_SAMPLE_DATA = "classpath:sample-data/warehouse.json";

    /**
     * Applies defaults for unset fields. Runs before Bean Validation, so only explicitly
     * configured negative day counts reach the {@code @Positive} checks.
     */
    public DemoProperties {
        if (domesticCountry == null || domesticCountry.isBlank()) {
            domesticCountry = "USA";
        }
        if (sampleData == null || sampleData.isBlank()) {
            sampleData = DEFAULT_SAMPLE_DATA;
        }
        if (cycleCountDays == 0) {
            cycleCountDays = 30;
        }
        if (expiringDays == 0) {
            expiringDays = 30;
        }
    }
}
