package com.criterion.specification.collection;

import com.criterion.specification.Specification;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Filters, counts and searches collections of candidates with a {@link Specification}.
 *
 * <p>Every operation visits elements in the source's own iteration order and rejects a null
 * source or specification with {@link IllegalArgumentException}. Exceptions thrown by the
 * specification propagate unchanged.
 */
public final class SpecificationFilters {

    private SpecificationFilters() {
        // utility class
    }

    /**
     * Returns a lazy view of the elements that satisfy the specification. Nothing is evaluated
     * until the view is iterated, and each new iteration re-applies the specification to the
     * current contents of {@code source}.
     */
    public static <T> Iterable<T> where(Iterable<T> source, Specification<? super T> specification) {
        requireArguments(source, specification);
        return () -> new FilteringIterator<>(source.iterator(), specification);
    }

    /** Returns a sequential stream of the elements that satisfy the specification. */
    public static <T> Stream<T> stream(Iterable<T> source, Specification<? super T> specification) {
        requireArguments(source, specification);
        return StreamSupport.stream(source.spliterator(), false).filter(specification::isSatisfiedBy);
    }

    /** Returns an unmodifiable snapshot of the elements that satisfy the specification. */
    public static <T> List<T> toList(Iterable<T> source, Specification<? super T> specification) {
        return stream(source, specification).toList();
    }

    /** Counts the elements that satisfy the specification. */
    public static <T> long count(Iterable<T> source, Specification<? super T> specification) {
        requireArguments(source, specification);
        long count = 0;
        for (T element : source) {
            if (specification.isSatisfiedBy(element)) {
                count++;
            }
        }
        return count;
    }

    /** Whether any element satisfies the specification; false for an empty source. */
    public static <T> boolean any(Iterable<T> source, Specification<? super T> specification) {
        requireArguments(source, specification);
        for (T element : source) {
            if (specification.isSatisfiedBy(element)) {
                return true;
            }
        }
        return false;
    }

    /** Whether every element satisfies the specification; true for an empty source. */
    public static <T> boolean all(Iterable<T> source, Specification<? super T> specification) {
        requireArguments(source, specification);
        for (T element : source) {
            if (!specification.isSatisfiedBy(element)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the first element that satisfies the specification.
     *
     * @throws NoSuchElementException if no element matches
     */
    public static <T> T first(Iterable<T> source, Specification<? super T> specification) {
        requireArguments(source, specification);
        for (T element : source) {
            if (specification.isSatisfiedBy(element)) {
                return element;
            }
        }
        throw noMatch(specification);
    }

    /**
     * Returns the first element that satisfies the specification, or empty when none does. A
     * matching {@code null} element is reported as empty; use {@link #first} to tell the two
     * apart.
     */
    public static <T> Optional<T> firstOrDefault(
            Iterable<T> source, Specification<? super T> specification) {
        requireArguments(source, specification);
        for (T element : source) {
            if (specification.isSatisfiedBy(element)) {
                return Optional.ofNullable(element);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the only element that satisfies the specification.
     *
     * @throws NoSuchElementException if no element matches
     * @throws AmbiguousMatchException if more than one element matches
     */
    public static <T> T single(Iterable<T> source, Specification<? super T> specification) {
        requireArguments(source, specification);
        T match = null;
        boolean found = false;
        for (T element : source) {
            if (specification.isSatisfiedBy(element)) {
                if (found) {
                    throw new AmbiguousMatchException(2);
                }
                match = element;
                found = true;
            }
        }
        if (!found) {
            throw noMatch(specification);
        }
        return match;
    }

    /**
     * Returns the only element that satisfies the specification, or empty when none does. A
     * matching {@code null} element is reported as empty; use {@link #single} to tell the two
     * apart.
     *
     * @throws AmbiguousMatchException if more than one element matches
     */
    public static <T> Optional<T> singleOrDefault(
            Iterable<T> source, Specification<? super T> specification) {
        requireArguments(source, specification);
        T match = null;
        boolean found = false;
        for (T element : source) {
            if (specification.isSatisfiedBy(element)) {
                if (found) {
                    throw new AmbiguousMatchException(2);
                }
                match = element;
                found = true;
            }
        }
        return Optional.ofNullable(match);
    }

    private static NoSuchElementException noMatch(Specification<?> specification) {
        return new NoSuchElementException("No element satisfies " + specification);
    }

    private static void requireArguments(Iterable<?> source, Specification<?> specification) {
        if (source == null) {
            throw new IllegalArgumentException("source must not be null");
        }
        if (specification == null) {
            throw new IllegalArgumentException("specification must not be null");
        }
    }

    /** Pull-based filter that looks ahead one element. */
    private static final class FilteringIterator<T> implements Iterator<T> {

        private final Iterator<T> delegate;
        private final Specification<? super T> specification;
        private T next;
        private boolean hasNext;

        FilteringIterator(Iterator<T> delegate, Specification<? super T> specification) {
            this.delegate = delegate;
            this.specification = specification;
        }

        @Override
        public boolean hasNext() {
            while (!hasNext && delegate.hasNext()) {
                T candidate = delegate.next();
                if (specification.isSatisfiedBy(candidate)) {
                    next = candidate;
                    hasNext = true;
                }
            }
            return hasNext;
        }

        @Override
        public T next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            hasNext = false;
            T result = next;
            next = null;
            return result;
        }
    }
}
