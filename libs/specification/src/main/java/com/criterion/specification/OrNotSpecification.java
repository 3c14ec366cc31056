package com.criterion.specification;

import java.util.List;

/**
 * Satisfied when {@code left} is satisfied or {@code right} is not.
 *
 * <p>Equivalent to {@code left.or(right.not())} without the intermediate {@link NotSpecification}.
 *
 * @param left evaluated first
 * @param right negated; skipped when {@code left} is satisfied
 * @param <T> the candidate type
 */
public record OrNotSpecification<T>(Specification<T> left, Specification<T> right)
        implements CompositeSpecification<T> {

    public OrNotSpecification {
        left = Operands.require(left, "left");
        right = Operands.require(right, "right");
    }

    @Override
    public boolean isSatisfiedBy(T candidate) {
        return left.isSatisfiedBy(candidate) || !right.isSatisfiedBy(candidate);
    }

    @Override
    public LogicalOperator operator() {
        return LogicalOperator.OR_NOT;
    }

    @Override
    public List<Specification<T>> operands() {
        return List.of(left, right);
    }

    @Override
    public String toString() {
        return Operands.describe(left, LogicalOperator.OR_NOT, right);
    }
}
