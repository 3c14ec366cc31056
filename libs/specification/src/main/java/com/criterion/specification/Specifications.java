package com.criterion.specification;

import java.util.List;
import java.util.function.Predicate;

/**
 * Static factories for adapting and folding specifications.
 *
 * <pre>{@code
 * Specification<Order> releasable = Specifications.allOf(List.of(isPending, isPaid, isInStock));
 * }</pre>
 */
public final class Specifications {

    private Specifications() {
        // utility class
    }

    /**
     * Adapts a {@link Predicate} to a specification.
     *
     * @throws IllegalArgumentException if {@code predicate} is null
     */
    public static <T> Specification<T> of(Predicate<? super T> predicate) {
        if (predicate == null) {
            throw new IllegalArgumentException("predicate must not be null");
        }
        return predicate::test;
    }

    /**
     * Wraps a specification so that it renders as {@code description} in composite descriptions.
     *
     * @throws IllegalArgumentException if {@code description} is blank or {@code specification}
     *     is null
     */
    public static <T> Specification<T> named(String description, Specification<T> specification) {
        return new NamedSpecification<>(description, specification);
    }

    /** A specification every candidate satisfies. */
    public static <T> Specification<T> always() {
        return named("always", candidate -> true);
    }

    /** A specification no candidate satisfies. */
    public static <T> Specification<T> never() {
        return named("never", candidate -> false);
    }

    /**
     * Folds the specifications left to right with AND. An empty list yields {@link #always()}.
     *
     * @throws IllegalArgumentException if the list or any element is null
     */
    public static <T> Specification<T> allOf(List<? extends Specification<T>> specifications) {
        return fold(specifications, LogicalOperator.AND);
    }

    /**
     * Folds the specifications left to right with OR. An empty list yields {@link #never()}.
     *
     * @throws IllegalArgumentException if the list or any element is null
     */
    public static <T> Specification<T> anyOf(List<? extends Specification<T>> specifications) {
        return fold(specifications, LogicalOperator.OR);
    }

    private static <T> Specification<T> fold(
            List<? extends Specification<T>> specifications, LogicalOperator operator) {
        if (specifications == null) {
            throw new IllegalArgumentException("specifications must not be null");
        }
        if (specifications.isEmpty()) {
            return operator == LogicalOperator.AND ? always() : never();
        }
        Specification<T> result = Operands.require(specifications.get(0), "specifications[0]");
        for (int i = 1; i < specifications.size(); i++) {
            Specification<T> next = Operands.require(specifications.get(i), "specifications[" + i + "]");
            result = operator == LogicalOperator.AND ? result.and(next) : result.or(next);
        }
        return result;
    }
}
