package com.criterion.warehouse.specification;

import com.criterion.specification.Specification;
import com.criterion.specification.Specifications;

/** Builds the named leaves of this package's catalogues. */
final class Rules {

    private Rules() {
        // utility class
    }

    /** Names {@code test} and answers false for a null candidate without evaluating it. */
    static <T> Specification<T> rule(String description, Specification<T> test) {
        return Specifications.named(description, candidate -> candidate != null && test.isSatisfiedBy(candidate));
    }
}
