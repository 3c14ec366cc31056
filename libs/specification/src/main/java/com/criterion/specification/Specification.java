package com.criterion.specification;

import java.util.function.Predicate;

/**
 * A business rule that a candidate of type {@code T} either satisfies or does not.
 *
 * <p>Implementations must be side-effect free and deterministic: the same candidate always
 * yields the same answer, and evaluating a specification never changes it. A leaf specification
 * that cannot meaningfully test a candidate (a {@code null} field, an empty string) answers
 * {@code false} rather than throwing, so that composites built from it stay total.
 *
 * <p>The combinator methods build new {@link CompositeSpecification} instances and never mutate
 * the receiver. Operands are not evaluated until {@link #isSatisfiedBy(Object)} is called on the
 * result.
 *
 * <p>Because this is a functional interface, a lambda is a valid leaf:
 *
 * <pre>{@code
 * Specification<Integer> isPositive = n -> n > 0;
 * Specification<Integer> smallPositive = isPositive.and(n -> n < 10);
 * }</pre>
 *
 * @param <T> the candidate type
 */
@FunctionalInterface
public interface Specification<T> {

    /**
     * Determines whether the candidate satisfies this specification.
     *
     * @param candidate the value to evaluate
     * @return true if the candidate satisfies the rule
     */
    boolean isSatisfiedBy(T candidate);

    /**
     * Returns a specification satisfied when both this and {@code other} are satisfied.
     *
     * @throws IllegalArgumentException if {@code other} is null
     */
    default Specification<T> and(Specification<T> other) {
        return new AndSpecification<>(this, other);
    }

    /**
     * Returns a specification satisfied when this is satisfied and {@code other} is not.
     *
     * @throws IllegalArgumentException if {@code other} is null
     */
    default Specification<T> andNot(Specification<T> other) {
        return new AndNotSpecification<>(this, other);
    }

    /**
     * Returns a specification satisfied when either this or {@code other} is satisfied.
     *
     * @throws IllegalArgumentException if {@code other} is null
     */
    default Specification<T> or(Specification<T> other) {
        return new OrSpecification<>(this, other);
    }

    /**
     * Returns a specification satisfied when this is satisfied or {@code other} is not.
     *
     * @throws IllegalArgumentException if {@code other} is null
     */
    default Specification<T> orNot(Specification<T> other) {
        return new OrNotSpecification<>(this, other);
    }

    /** Returns a specification satisfied exactly when this one is not. */
    default Specification<T> not() {
        return new NotSpecification<>(this);
    }

    /** Views this specification as a {@link Predicate}, e.g. for {@code Stream.filter}. */
    default Predicate<T> asPredicate() {
        return this::isSatisfiedBy;
    }
}
