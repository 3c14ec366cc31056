package com.criterion.specification;

import java.util.List;

/**
 * Satisfied when at least one operand is satisfied.
 *
 * @param left evaluated first
 * @param right skipped when {@code left} is satisfied
 * @param <T> the candidate type
 */
public record OrSpecification<T>(Specification<T> left, Specification<T> right)
        implements CompositeSpecification<T> {

    public OrSpecification {
        left = Operands.require(left, "left");
        right = Operands.require(right, "right");
    }

    @Override
    public boolean isSatisfiedBy(T candidate) {
        return left.isSatisfiedBy(candidate) || right.isSatisfiedBy(candidate);
    }

    @Override
    public LogicalOperator operator() {
        return LogicalOperator.OR;
    }

    @Override
    public List<Specification<T>> operands() {
        return List.of(left, right);
    }

    @Override
    public String toString() {
        return Operands.describe(left, LogicalOperator.OR, right);
    }
}
