package com.criterion.specification;

/** Construction-time checks and rendering shared by the composite records. */
final class Operands {

    private Operands() {
        // utility class
    }

    static <T> Specification<T> require(Specification<T> operand, String name) {
        if (operand == null) {
            throw new IllegalArgumentException(name + " must not be null");
        }
        return operand;
    }

    static String describe(Specification<?> left, LogicalOperator operator, Specification<?> right) {
        return "(" + left + " " + operator.symbol() + " " + right + ")";
    }
}
