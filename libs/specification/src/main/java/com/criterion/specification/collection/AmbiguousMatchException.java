package com.criterion.specification.collection;

/**
 * Thrown when a single-match lookup finds more than one candidate satisfying the specification.
 */
public class AmbiguousMatchException extends IllegalStateException {

    private final long matchCount;

    public AmbiguousMatchException(long matchCount) {
        super("Expected at most one matching element but found %d".formatted(matchCount));
        this.matchCount = matchCount;
    }

    /** Number of matching elements seen before the lookup gave up (at least 2). */
    public long matchCount() {
        return matchCount;
    }
}
