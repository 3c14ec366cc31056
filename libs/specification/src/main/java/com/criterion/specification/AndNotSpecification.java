package com.criterion.specification;

import java.util.List;

/**
 * Satisfied when {@code left} is satisfied and {@code right} is not.
 *
 * <p>Equivalent to {@code left.and(right.not())} without the intermediate {@link NotSpecification}.
 *
 * @param left evaluated first
 * @param right negated; skipped when {@code left} is not satisfied
 * @param <T> the candidate type
 */
public record AndNotSpecification<T>(Specification<T> left, Specification<T> right)
        implements CompositeSpecification<T> {

    public AndNotSpecification {
        left = Operands.require(left, "left");
        right = Operands.require(right, "right");
    }

    @Override
    public boolean isSatisfiedBy(T candidate) {
        return left.isSatisfiedBy(candidate) && !right.isSatisfiedBy(candidate);
    }

    @Override
    public LogicalOperator operator() {
        return LogicalOperator.AND_NOT;
    }

    @Override
    public List<Specification<T>> operands() {
        return List.of(left, right);
    }

    @Override
    public String toString() {
        return Operands.describe(left, LogicalOperator.AND_NOT, right);
    }
}
