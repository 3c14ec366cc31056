package com.criterion.specification;

/**
 * Leaf decorator that gives a specification a readable name. Evaluation is delegated unchanged.
 *
 * @param description rendered by {@link #toString()}
 * @param delegate the wrapped specification
 * @param <T> the candidate type
 */
public record NamedSpecification<T>(String description, Specification<T> delegate)
        implements Specification<T> {

    public NamedSpecification {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("description must not be null or blank");
        }
        delegate = Operands.require(delegate, "delegate");
    }

    @Override
    public boolean isSatisfiedBy(T candidate) {
        return delegate.isSatisfiedBy(candidate);
    }

    @Override
    public String toString() {
        return description;
    }
}
