package com.criterion.specification;

import java.util.List;

/**
 * Satisfied exactly when {@code operand} is not.
 *
 * @param operand the negated specification
 * @param <T> the candidate type
 */
public record NotSpecification<T>(Specification<T> operand) implements CompositeSpecification<T> {

    public NotSpecification {
        operand = Operands.require(operand, "operand");
    }

    @Override
    public boolean isSatisfiedBy(T candidate) {
        return !operand.isSatisfiedBy(candidate);
    }

    @Override
    public LogicalOperator operator() {
        return LogicalOperator.NOT;
    }

    @Override
    public List<Specification<T>> operands() {
        return List.of(operand);
    }

    @Override
    public String toString() {
        return "NOT " + operand;
    }
}
