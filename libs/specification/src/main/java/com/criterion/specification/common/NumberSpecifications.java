package com.criterion.specification.common;

import com.criterion.specification.Specification;
import com.criterion.specification.Specifications;

/**
 * Reusable rules over {@link Integer} candidates. A {@code null} candidate never satisfies any of
 * them.
 */
public final class NumberSpecifications {

    private NumberSpecifications() {
        // utility class
    }

    /** Satisfied by values strictly greater than zero. */
    public static Specification<Integer> isPositive() {
        return Specifications.named("isPositive", n -> n != null && n > 0);
    }

    /** Satisfied by even values, including zero and negative even values. */
    public static Specification<Integer> isEven() {
        return Specifications.named("isEven", n -> n != null && n % 2 == 0);
    }

    /**
     * Satisfied by values in the closed range {@code [min, max]}.
     *
     * @throws IllegalArgumentException if {@code max < min}
     */
    public static Specification<Integer> isInRange(int min, int max) {
        if (max < min) {
            throw new IllegalArgumentException(
                    "max must be >= min (min=%d, max=%d)".formatted(min, max));
        }
        return Specifications.named(
                "isInRange[%d, %d]".formatted(min, max), n -> n != null && n >= min && n <= max);
    }
}
