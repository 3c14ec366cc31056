package com.criterion.specification;

import java.util.List;

/**
 * A specification built from one or two other specifications with a fixed {@link
 * LogicalOperator}.
 *
 * <p>The set of variants is closed: callers can switch over {@link #operator()} and rely on every
 * composite being one of the five records below. All of them are immutable, hold their operands
 * by shared reference, re-evaluate those operands on every call and let any exception thrown by
 * an operand propagate unchanged.
 *
 * @param <T> the candidate type
 */
public sealed interface CompositeSpecification<T> extends Specification<T>
        permits AndSpecification, OrSpecification, NotSpecification, AndNotSpecification,
                OrNotSpecification {

    /** The combinator this composite applies. */
    LogicalOperator operator();

    /** The operands in evaluation order (left first); a single element for NOT. */
    List<Specification<T>> operands();
}
