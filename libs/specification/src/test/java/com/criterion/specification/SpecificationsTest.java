package com.criterion.specification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.List;
import java.util.function.Predicate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Specifications")
class SpecificationsTest {

    private static final Specification<Integer> POSITIVE = n -> n > 0;
    private static final Specification<Integer> EVEN = n -> n % 2 == 0;
    private static final Specification<Integer> SMALL = n -> n < 10;

    @Test
    @DisplayName("of() adapts a java.util.function.Predicate")
    void adaptsPredicate() {
        Predicate<Object> notNull = o -> o != null;
        Specification<String> spec = Specifications.of(notNull);
        assertThat(spec.isSatisfiedBy("x")).isTrue();
        assertThat(spec.isSatisfiedBy(null)).isFalse();
        assertThatThrownBy(() -> Specifications.of(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("always() and never() are constant")
    void constants() {
        assertThat(Specifications.<String>always().isSatisfiedBy(null)).isTrue();
        assertThat(Specifications.<String>never().isSatisfiedBy("anything")).isFalse();
        assertThat(Specifications.always()).hasToString("always");
    }

    @Test
    @DisplayName("always() and never() bind to any candidate type")
    void constantsAreTyped() {
        Specification<Integer> none = Specifications.never();
        Specification<Integer> positiveOrNone = POSITIVE.or(none);

        assertThat(none).hasToString("never");
        assertThat(positiveOrNone.isSatisfiedBy(3)).isTrue();
        assertThat(positiveOrNone.isSatisfiedBy(-3)).isFalse();
    }

    @Nested
    @DisplayName("named()")
    class Named {

        @Test
        @DisplayName("delegates evaluation and renders its description")
        void delegates() {
            var named = Specifications.named("even", EVEN);
            assertThat(named.isSatisfiedBy(4)).isTrue();
            assertThat(named.isSatisfiedBy(5)).isFalse();
            assertThat(named).hasToString("even");
        }

        @Test
        @DisplayName("rejects blank descriptions and null delegates")
        void rejectsInvalidArguments() {
            assertThatThrownBy(() -> Specifications.named(" ", EVEN))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("description");
            assertThatThrownBy(() -> Specifications.named("even", null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("delegate");
        }
    }

    @Nested
    @DisplayName("allOf() / anyOf()")
    class Folds {

        @Test
        @DisplayName("allOf requires every specification")
        void allOf() {
            var spec = Specifications.allOf(List.of(POSITIVE, EVEN, SMALL));
            assertThat(spec.isSatisfiedBy(4)).isTrue();
            assertThat(spec.isSatisfiedBy(12)).isFalse();
            assertThat(spec.isSatisfiedBy(-2)).isFalse();
        }

        @Test
        @DisplayName("anyOf requires at least one specification")
        void anyOf() {
            var spec = Specifications.anyOf(List.of(POSITIVE, EVEN));
            assertThat(spec.isSatisfiedBy(-2)).isTrue();
            assertThat(spec.isSatisfiedBy(3)).isTrue();
            assertThat(spec.isSatisfiedBy(-3)).isFalse();
        }

        @Test
        @DisplayName("a single element folds to itself")
        void singleElement() {
            assertThat(Specifications.allOf(List.of(EVEN))).isSameAs(EVEN);
        }

        @Test
        @DisplayName("empty lists fold to the identity element")
        void emptyLists() {
            assertThat(Specifications.<Integer>allOf(List.of()).isSatisfiedBy(1)).isTrue();
            assertThat(Specifications.<Integer>anyOf(List.of()).isSatisfiedBy(1)).isFalse();
        }

        @Test
        @DisplayName("null list or element is rejected at construction")
        void rejectsNulls() {
            assertThatThrownBy(() -> Specifications.<Integer>allOf(null))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> Specifications.anyOf(Arrays.asList(POSITIVE, null)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("specifications[1]");
        }
    }
}
