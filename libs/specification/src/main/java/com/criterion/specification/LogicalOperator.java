package com.criterion.specification;

/** The boolean combinators a {@link CompositeSpecification} can apply to its operands. */
public enum LogicalOperator {
    AND("AND", 2),
    OR("OR", 2),
    NOT("NOT", 1),
    AND_NOT("AND NOT", 2),
    OR_NOT("OR NOT", 2);

    private final String symbol;
    private final int arity;

    LogicalOperator(String symbol, int arity) {
        this.symbol = symbol;
        this.arity = arity;
    }

    /** Infix keyword used when rendering a composite (e.g., "AND NOT"). */
    public String symbol() {
        return symbol;
    }

    /** Number of operands the operator takes: 1 for NOT, 2 otherwise. */
    public int arity() {
        return arity;
    }

    /** Whether the operator combines two operands. */
    public boolean isBinary() {
        return arity == 2;
    }
}
