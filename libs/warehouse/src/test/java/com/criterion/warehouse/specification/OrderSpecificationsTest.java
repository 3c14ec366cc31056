package com.criterion.warehouse.specification;

import static com.criterion.warehouse.testing.TestWarehouseFactory.REFERENCE_TIME;
import static com.criterion.warehouse.testing.TestWarehouseFactory.daysFromReference;
import static com.criterion.warehouse.testing.TestWarehouseFactory.fixedClock;
import static com.criterion.warehouse.testing.TestWarehouseFactory.hoursFromReference;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.criterion.specification.Specification;
import com.criterion.warehouse.model.Order;
import com.criterion.warehouse.model.OrderFactory;
import com.criterion.warehouse.model.OrderLine;
import com.criterion.warehouse.model.OrderPriority;
import com.criterion.warehouse.model.OrderStatus;
import com.criterion.warehouse.model.ShippingMethod;
import com.criterion.warehouse.testing.TestWarehouseFactory;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("OrderSpecifications")
class OrderSpecificationsTest {

    private static Order dueAt(Instant requiredBy, OrderStatus status) {
        return TestWarehouseFactory.order(OrderPriority.NORMAL, ShippingMethod.GROUND, status, requiredBy,
                List.of(TestWarehouseFactory.orderLine()));
    }

    private static Order withLines(List<OrderLine> lines) {
        return TestWarehouseFactory.order(OrderPriority.NORMAL, ShippingMethod.GROUND, OrderStatus.PICKED,
                daysFromReference(3), lines);
    }

    private static Order toCountry(String country) {
        return new Order("O1", "C1", REFERENCE_TIME, daysFromReference(1), OrderPriority.NORMAL,
                ShippingMethod.INTERNATIONAL, country, OrderStatus.PENDING, List.of(new OrderLine("SKU", 1, 0)));
    }

    @Nested
    @DisplayName("Priority and status")
    class PriorityAndStatus {

        @Test
        @DisplayName("isUrgent should match rush and same-day")
        void isUrgent() {
            var spec = OrderSpecifications.isUrgent();

            assertThat(spec.isSatisfiedBy(TestWarehouseFactory.order(OrderPriority.RUSH, ShippingMethod.GROUND)))
                    .isTrue();
            assertThat(spec.isSatisfiedBy(TestWarehouseFactory.order(OrderPriority.SAME_DAY, ShippingMethod.GROUND)))
                    .isTrue();
            assertThat(spec.isSatisfiedBy(TestWarehouseFactory.order(OrderPriority.HIGH, ShippingMethod.GROUND)))
                    .isFalse();
        }

        @Test
        @DisplayName("isReadyToShip should match packed orders")
        void isReadyToShip() {
            assertThat(OrderSpecifications.isReadyToShip().isSatisfiedBy(dueAt(daysFromReference(1), OrderStatus.PACKED)))
                    .isTrue();
            assertThat(OrderSpecifications.isReadyToShip().isSatisfiedBy(dueAt(daysFromReference(1), OrderStatus.PICKED)))
                    .isFalse();
        }

        @Test
        @DisplayName("simple lookups should match their field")
        void lookups() {
            var order = TestWarehouseFactory.order(OrderPriority.HIGH, ShippingMethod.OVERNIGHT);

            assertThat(OrderSpecifications.hasPriority(OrderPriority.HIGH).isSatisfiedBy(order)).isTrue();
            assertThat(OrderSpecifications.hasShippingMethod(ShippingMethod.OVERNIGHT).isSatisfiedBy(order)).isTrue();
            assertThat(OrderSpecifications.hasStatus(OrderStatus.PENDING).isSatisfiedBy(order)).isTrue();
            assertThat(OrderSpecifications.belongsToClient(TestWarehouseFactory.CLIENT_ID).isSatisfiedBy(order))
                    .isTrue();
        }
    }

    @Nested
    @DisplayName("Due dates")
    class DueDates {

        @Test
        @DisplayName("isOverdue should ignore closed orders")
        void isOverdue() {
            var spec = OrderSpecifications.isOverdue(fixedClock());

            assertThat(spec.isSatisfiedBy(dueAt(hoursFromReference(-1), OrderStatus.IN_PROGRESS))).isTrue();
            assertThat(spec.isSatisfiedBy(dueAt(hoursFromReference(-1), OrderStatus.SHIPPED))).isFalse();
            assertThat(spec.isSatisfiedBy(dueAt(hoursFromReference(-1), OrderStatus.CANCELLED))).isFalse();
            assertThat(spec.isSatisfiedBy(dueAt(hoursFromReference(1), OrderStatus.PENDING))).isFalse();
        }

        @Test
        @DisplayName("isDueSoon should default to 24 hours and exclude past due dates")
        void isDueSoon() {
            var spec = OrderSpecifications.isDueSoon(fixedClock());

            assertThat(spec.isSatisfiedBy(dueAt(hoursFromReference(24), OrderStatus.PENDING))).isTrue();
            assertThat(spec.isSatisfiedBy(dueAt(hoursFromReference(25), OrderStatus.PENDING))).isFalse();
            assertThat(spec.isSatisfiedBy(dueAt(REFERENCE_TIME, OrderStatus.PENDING))).isFalse();
            assertThat(spec.isSatisfiedBy(dueAt(hoursFromReference(-2), OrderStatus.PENDING))).isFalse();
        }

        @Test
        @DisplayName("requiresExpeditedProcessing should match urgent, fast shipping or due within 8 hours")
        void requiresExpeditedProcessing() {
            var spec = OrderSpecifications.requiresExpeditedProcessing(fixedClock());

            assertThat(spec.isSatisfiedBy(TestWarehouseFactory.order(OrderPriority.RUSH, ShippingMethod.GROUND)))
                    .isTrue();
            assertThat(spec.isSatisfiedBy(TestWarehouseFactory.order(OrderPriority.LOW, ShippingMethod.TWO_DAY_AIR)))
                    .isTrue();
            assertThat(spec.isSatisfiedBy(dueAt(hoursFromReference(7), OrderStatus.PENDING))).isTrue();
            assertThat(spec.isSatisfiedBy(dueAt(hoursFromReference(8), OrderStatus.PENDING))).isFalse();
            assertThat(spec.isSatisfiedBy(TestWarehouseFactory.order())).isFalse();
        }

        @Test
        @DisplayName("isPlacedToday should compare calendar dates in the clock's zone")
        void isPlacedToday() {
            var order = TestWarehouseFactory.order();
            var utc = fixedClock();
            var dayAhead = Clock.fixed(REFERENCE_TIME, ZoneId.of("Pacific/Kiritimati"));
            var nextDay = Clock.fixed(daysFromReference(1), ZoneId.of("UTC"));

            assertThat(OrderSpecifications.isPlacedToday(utc).isSatisfiedBy(order)).isTrue();
            assertThat(OrderSpecifications.isPlacedToday(dayAhead).isSatisfiedBy(order)).isTrue();
            assertThat(OrderSpecifications.isPlacedToday(nextDay).isSatisfiedBy(order)).isFalse();
        }

        @Test
        @DisplayName("isDueSoon should reject negative hours")
        void negativeHours() {
            assertThatThrownBy(() -> OrderSpecifications.isDueSoon(fixedClock(), -1))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Lines")
    class Lines {

        @Test
        @DisplayName("picking progress should be read from the lines")
        void pickingProgress() {
            var complete = withLines(List.of(OrderFactory.line("A", 2, 2), OrderFactory.line("B", 1, 1)));
            var partial = withLines(List.of(OrderFactory.line("A", 2, 2), OrderFactory.line("B", 3, 1)));
            var untouched = withLines(List.of(OrderFactory.line("A", 2, 0)));

            assertThat(OrderSpecifications.isCompletelyPicked().isSatisfiedBy(complete)).isTrue();
            assertThat(OrderSpecifications.isCompletelyPicked().isSatisfiedBy(partial)).isFalse();
            assertThat(OrderSpecifications.hasPartialPicks().isSatisfiedBy(partial)).isTrue();
            assertThat(OrderSpecifications.hasPartialPicks().isSatisfiedBy(untouched)).isFalse();
        }

        @Test
        @DisplayName("isLargeOrder should default to more than 10 lines")
        void isLargeOrder() {
            var ten = withLines(Collections.nCopies(10, OrderFactory.line("A", 1)));
            var eleven = withLines(Collections.nCopies(11, OrderFactory.line("A", 1)));

            assertThat(OrderSpecifications.isLargeOrder().isSatisfiedBy(ten)).isFalse();
            assertThat(OrderSpecifications.isLargeOrder().isSatisfiedBy(eleven)).isTrue();
            assertThat(OrderSpecifications.isLargeOrder(1).isSatisfiedBy(TestWarehouseFactory.order())).isFalse();
        }

        @Test
        @DisplayName("isLargeOrder should need a positive threshold")
        void isLargeOrderThreshold() {
            assertThatThrownBy(() -> OrderSpecifications.isLargeOrder(0))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("lineThreshold must be > 0");
        }
    }

    @Nested
    @DisplayName("Destination")
    class Destination {

        @Test
        @DisplayName("isInternational should compare countries ignoring case")
        void isInternational() {
            var spec = OrderSpecifications.isInternational();

            assertThat(spec.isSatisfiedBy(toCountry("usa"))).isFalse();
            assertThat(spec.isSatisfiedBy(toCountry("Canada"))).isTrue();
            assertThat(OrderSpecifications.isInternational("Canada").isSatisfiedBy(toCountry("CANADA"))).isFalse();
        }

        @Test
        @DisplayName("isInternational should reject a blank home country")
        void blankCountry() {
            assertThatThrownBy(() -> OrderSpecifications.isInternational(" "))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("domesticCountry must not be null or blank");
        }
    }

    @Test
    @DisplayName("null order satisfies no rule")
    void nullCandidate() {
        List<Specification<Order>> rules =
                List.of(
                        OrderSpecifications.belongsToClient("C1"),
                        OrderSpecifications.hasPriority(OrderPriority.NORMAL),
                        OrderSpecifications.isUrgent(),
                        OrderSpecifications.hasStatus(OrderStatus.PENDING),
                        OrderSpecifications.isOverdue(fixedClock()),
                        OrderSpecifications.isDueSoon(fixedClock()),
                        OrderSpecifications.isInternational(),
                        OrderSpecifications.hasShippingMethod(ShippingMethod.GROUND),
                        OrderSpecifications.isReadyToShip(),
                        OrderSpecifications.isCompletelyPicked(),
                        OrderSpecifications.hasPartialPicks(),
                        OrderSpecifications.isLargeOrder(),
                        OrderSpecifications.requiresExpeditedProcessing(fixedClock()),
                        OrderSpecifications.isPlacedToday(fixedClock()));

        assertThat(rules).allSatisfy(rule -> assertThat(rule.isSatisfiedBy(null)).as(rule.toString()).isFalse());
    }
}
