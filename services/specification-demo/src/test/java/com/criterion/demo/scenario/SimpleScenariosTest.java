package com.criterion.demo.scenario;

import static org.assertj.core.api.Assertions.assertThat;

import com.criterion.demo.scenario.SimpleScenarios.User;
import com.criterion.specification.collection.SpecificationFilters;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.function.Consumer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SimpleScenarios")
class SimpleScenariosTest {

    private final SimpleScenarios scenarios = new SimpleScenarios();

    private static String capture(Consumer<PrintStream> body) {
        var buffer = new ByteArrayOutputStream();
        body.accept(new PrintStream(buffer, true, StandardCharsets.UTF_8));
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("should expose five titled scenarios")
    void fiveScenarios() {
        assertThat(scenarios.scenarios())
                .extracting(Scenario::title)
                .containsExactly(
                        "User Validation",
                        "Email Validation",
                        "Number Range Validation",
                        "Password Strength Validation",
                        "NOT Operator");
    }

    @Test
    @DisplayName("active adults should exclude minors and inactive users")
    void activeAdults() {
        var activeAdults = SpecificationFilters.toList(
                SimpleScenarios.USERS, SimpleScenarios.isAdult().and(SimpleScenarios.isActiveUser()));

        assertThat(activeAdults).extracting(User::username).containsExactly("user1", "user4");
        assertThat(capture(scenarios::userValidation)).contains("Total: 2");
    }

    @Test
    @DisplayName("email rule should accept only well-formed, non-spam addresses")
    void emails() {
        var rule = SimpleScenarios.validNonSpamEmail();

        assertThat(SpecificationFilters.toList(SimpleScenarios.EMAILS, rule))
                .containsExactly("valid@example.com", "admin@company.com");
        assertThat(capture(scenarios::emailValidation)).contains("[rejected] test@spam.com", "[rejected] (empty)");
    }

    @Test
    @DisplayName("number ranges should differ between AND and OR")
    void numberRanges() {
        var output = capture(scenarios::numberRanges);

        assertThat(output).contains("Positive AND in range [1, 100]: 15, 25, 50, 75");
        assertThat(output).contains("Positive OR in range [1, 100]:  15, 25, 50, 75, 101");
    }

    @Test
    @DisplayName("only the password with length, symbol and digit should be strong")
    void passwords() {
        assertThat(SpecificationFilters.toList(SimpleScenarios.PASSWORDS, SimpleScenarios.strongPassword()))
                .containsExactly("ValidP@ssw0rd");
    }

    @Test
    @DisplayName("NOT should produce the odd numbers")
    void notOperator() {
        assertThat(capture(scenarios::notOperator))
                .contains("Odd numbers (NOT even): 1, 3, 5, 7, 9, 11, 13, 15, 17, 19");
    }

    @Test
    @DisplayName("running a scenario should print its heading")
    void heading() {
        var output = capture(out -> scenarios.scenarios().get(4).run(out));

        assertThat(output).startsWith("=== NOT Operator ===");
    }
}
