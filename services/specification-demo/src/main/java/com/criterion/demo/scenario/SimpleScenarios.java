package com.criterion.demo.scenario;

import static com.criterion.specification.collection.SpecificationFilters.toList;

import com.criterion.specification.Specification;
import com.criterion.specification.Specifications;
import com.criterion.specification.common.NumberSpecifications;
import com.criterion.specification.common.StringSpecifications;
import java.io.PrintStream;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.springframework.stereotype.Component;

/** Introductory scenarios over users, strings and integers. */
@Component
public class SimpleScenarios {

    /** A user account for the validation scenario. */
    public record User(String username, String email, int age, boolean active) {}

    static final List<User> USERS = List.of(
            new User("user1", "john@example.com", 25, true),
            new User("user2", "jane@example.com", 17, true),
            new User("user3", "bob@example.com", 30, false),
            new User("user4", "alice@example.com", 22, true));

    static final List<String> EMAILS =
            List.of("valid@example.com", "invalid-email", "test@spam.com", "admin@company.com", "");

    static final List<Integer> NUMBERS = List.of(-5, 0, 15, 25, 50, 75, 101);

    static final List<String> PASSWORDS =
            List.of("short", "longbutnosymbols", "Long@WithSymbol", "NoNum@Symbol", "ValidP@ssw0rd");

    public static Specification<User> isAdult() {
        return Specifications.named("isAdult", u -> u.age() >= 18);
    }

    public static Specification<User> isActiveUser() {
        return Specifications.named("isActiveUser", User::active);
    }

    public static Specification<String> validNonSpamEmail() {
        return StringSpecifications.hasAtSymbol()
                .and(StringSpecifications.hasDomain())
                .and(StringSpecifications.notSpamDomain());
    }

    public static Specification<String> strongPassword() {
        return StringSpecifications.minLength(8)
                .and(StringSpecifications.hasSpecialCharacter())
                .and(StringSpecifications.hasDigit());
    }

    public List<Scenario> scenarios() {
        return List.of(
                new Scenario("User Validation", this::userValidation),
                new Scenario("Email Validation", this::emailValidation),
                new Scenario("Number Range Validation", this::numberRanges),
                new Scenario("Password Strength Validation", this::passwordStrength),
                new Scenario("NOT Operator", this::notOperator));
    }

    void userValidation(PrintStream out) {
        var activeAdults = toList(USERS, isAdult().and(isActiveUser()));
        out.println("Active adult users:");
        activeAdults.forEach(u -> out.printf("  - %s (%s), age %d%n", u.username(), u.email(), u.age()));
        out.println();
        out.println("Total: " + activeAdults.size());
    }

    void emailValidation(PrintStream out) {
        var rule = validNonSpamEmail();
        out.println("Rule: " + rule);
        for (String email : EMAILS) {
            out.printf("  [%s] %s%n", rule.isSatisfiedBy(email) ? "valid" : "rejected", email.isEmpty() ? "(empty)" : email);
        }
    }

    void numberRanges(PrintStream out) {
        var isPositive = NumberSpecifications.isPositive();
        var inRange = NumberSpecifications.isInRange(1, 100);
        out.println("Positive AND in range [1, 100]: " + join(toList(NUMBERS, isPositive.and(inRange))));
        out.println("Positive OR in range [1, 100]:  " + join(toList(NUMBERS, isPositive.or(inRange))));
    }

    void passwordStrength(PrintStream out) {
        var rule = strongPassword();
        for (String password : PASSWORDS) {
            out.printf("  %-20s %s%n", password, rule.isSatisfiedBy(password) ? "strong" : "weak");
        }
    }

    void notOperator(PrintStream out) {
        var numbers = IntStream.rangeClosed(1, 20).boxed().collect(Collectors.toList());
        var isEven = NumberSpecifications.isEven();
        out.println("Even numbers:           " + join(toList(numbers, isEven)));
        out.println("Odd numbers (NOT even): " + join(toList(numbers, isEven.not())));
    }

    private static String join(List<Integer> numbers) {
        return numbers.stream().map(String::valueOf).collect(Collectors.joining(", "));
    }
}
