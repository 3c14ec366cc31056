package com.criterion.warehouse.model;

import java.util.List;

/**
 * Result of validating a warehouse record.
 *
 * @param valid true if validation passed with no errors
 * @param errors list of human-readable error messages (empty when valid)
 */
public record ValidationResult(boolean valid, List<String> errors) {

    /** Convenience factory for a successful validation. */
    public static ValidationResult ok() {
        return new ValidationResult(true, List.of());
    }

    /** Convenience factory for a failed validation. */
    public static ValidationResult fail(List<String> errors) {
        return new ValidationResult(false, List.copyOf(errors));
    }

    static ValidationResult of(List<String> errors) {
        return errors.isEmpty() ? ok() : fail(errors);
    }

    /**
     * Throws if this result is invalid.
     *
     * @param subject what was validated, used as the message prefix (e.g., "order ORD-1")
     * @throws IllegalArgumentException listing every error
     */
    public void throwIfInvalid(String subject) {
        if (!valid) {
            throw new IllegalArgumentException("Invalid " + subject + ": " + String.join("; ", errors));
        }
    }
}
