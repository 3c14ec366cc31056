package com.criterion.specification.common;

import com.criterion.specification.Specification;
import com.criterion.specification.Specifications;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reusable rules over {@link String} candidates, mostly for passwords and e-mail addresses.
 *
 * <p>Null and empty candidates never satisfy a positive rule. {@link #notSpamDomain()} is a
 * negative rule and is satisfied by anything that has no domain to reject.
 */
public final class StringSpecifications {

    /** Domains rejected by {@link #notSpamDomain()}. */
    public static final Set<String> DEFAULT_SPAM_DOMAINS = Set.of("spam.com", "junk.com", "trash.com");

    private StringSpecifications() {
        // utility class
    }

    /**
     * Satisfied by strings at least {@code minLength} characters long.
     *
     * @throws IllegalArgumentException if {@code minLength} is negative
     */
    public static Specification<String> minLength(int minLength) {
        if (minLength < 0) {
            throw new IllegalArgumentException("minLength must be >= 0");
        }
        return Specifications.named(
                "minLength(" + minLength + ")",
                s -> !isEmpty(s) && s.length() >= minLength);
    }

    /** Satisfied by strings containing at least one digit. */
    public static Specification<String> hasDigit() {
        return Specifications.named(
                "hasDigit", s -> !isEmpty(s) && s.chars().anyMatch(Character::isDigit));
    }

    /** Satisfied by strings containing a character that is neither a letter nor a digit. */
    public static Specification<String> hasSpecialCharacter() {
        return Specifications.named(
                "hasSpecialCharacter",
                s -> !isEmpty(s) && s.chars().anyMatch(c -> !Character.isLetterOrDigit(c)));
    }

    /** Satisfied by strings containing {@code @}. */
    public static Specification<String> hasAtSymbol() {
        return Specifications.named("hasAtSymbol", s -> !isEmpty(s) && s.indexOf('@') >= 0);
    }

    /**
     * Satisfied by addresses of the form {@code local@domain.tld}: exactly one {@code @}, a
     * non-empty local part, and a domain that contains a dot without starting or ending with one.
     */
    public static Specification<String> hasDomain() {
        return Specifications.named("hasDomain", StringSpecifications::isWellFormedAddress);
    }

    /** {@link #notSpamDomain(Set)} with {@link #DEFAULT_SPAM_DOMAINS}. */
    public static Specification<String> notSpamDomain() {
        return notSpamDomain(DEFAULT_SPAM_DOMAINS);
    }

    /**
     * Satisfied unless the candidate's domain (the text after {@code @}) is one of {@code
     * blockedDomains}, compared case-insensitively. Candidates without an {@code @} have no domain
     * and are satisfied.
     *
     * @throws IllegalArgumentException if {@code blockedDomains} is or contains null
     */
    public static Specification<String> notSpamDomain(Set<String> blockedDomains) {
        if (blockedDomains == null) {
            throw new IllegalArgumentException("blockedDomains must not be null");
        }
        if (blockedDomains.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("blockedDomains must not contain null");
        }
        Set<String> blocked =
                blockedDomains.stream()
                        .map(d -> d.toLowerCase(Locale.ROOT))
                        .collect(Collectors.toUnmodifiableSet());
        return Specifications.named(
                "notSpamDomain",
                s -> {
                    if (isEmpty(s) || s.indexOf('@') < 0) {
                        return true;
                    }
                    String domain = s.substring(s.indexOf('@') + 1);
                    return !blocked.contains(domain.toLowerCase(Locale.ROOT));
                });
    }

    private static boolean isWellFormedAddress(String s) {
        if (isEmpty(s)) {
            return false;
        }
        int at = s.indexOf('@');
        if (at <= 0 || at != s.lastIndexOf('@')) {
            return false;
        }
        String domain = s.substring(at + 1);
        return domain.indexOf('.') >= 0 && !domain.startsWith(".") && !domain.endsWith(".");
    }

    private static boolean isEmpty(String s) {
        return s == null || s.isEmpty();
    }
}
