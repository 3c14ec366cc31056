package com.criterion.warehouse.specification;

import static com.criterion.warehouse.specification.Arguments.requireNonBlank;
import static com.criterion.warehouse.specification.Arguments.requireNonNegative;
import static com.criterion.warehouse.specification.Arguments.requireNonNull;
import static com.criterion.warehouse.specification.Arguments.requirePositive;
import static com.criterion.warehouse.specification.Rules.rule;

import com.criterion.specification.Specification;
import com.criterion.warehouse.model.Order;
import com.criterion.warehouse.model.OrderLine;
import com.criterion.warehouse.model.OrderPriority;
import com.criterion.warehouse.model.OrderStatus;
import com.criterion.warehouse.model.ShippingMethod;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;

/**
 * Rules over {@link Order} candidates.
 *
 * <p>Time-based rules read the current instant from the supplied {@link Clock} on every
 * evaluation, so a fixed clock makes them reproducible.
 */
public final class OrderSpecifications {

    public static final String DEFAULT_DOMESTIC_COUNTRY = "USA";
    public static final int DEFAULT_DUE_SOON_HOURS = 24;
    public static final int DEFAULT_LARGE_ORDER_LINES = 10;

    /** Orders due within this many hours are always expedited. */
    public static final int EXPEDITE_WITHIN_HOURS = 8;

    private OrderSpecifications() {
        // utility class
    }

    public static Specification<Order> belongsToClient(String clientId) {
        requireNonBlank(clientId, "clientId");
        return rule("order.belongsToClient[" + clientId + "]", o -> clientId.equals(o.clientId()));
    }

    public static Specification<Order> hasPriority(OrderPriority priority) {
        requireNonNull(priority, "priority");
        return rule("order.hasPriority[" + priority + "]", o -> o.priority() == priority);
    }

    /** Rush and same-day orders. */
    public static Specification<Order> isUrgent() {
        return rule("order.isUrgent", OrderSpecifications::urgent);
    }

    public static Specification<Order> hasStatus(OrderStatus status) {
        requireNonNull(status, "status");
        return rule("order.hasStatus[" + status + "]", o -> o.status() == status);
    }

    /** Open orders whose required date has passed. */
    public static Specification<Order> isOverdue(Clock clock) {
        requireNonNull(clock, "clock");
        return rule("order.isOverdue", o -> o.requiredBy() != null
                && o.requiredBy().isBefore(clock.instant())
                && (o.status() == null || !o.status().isClosed()));
    }

    public static Specification<Order> isDueSoon(Clock clock) {
        return isDueSoon(clock, DEFAULT_DUE_SOON_HOURS);
    }

    /**
     * Satisfied when the required date is in the future but no more than {@code hours} away.
     *
     * @throws IllegalArgumentException if {@code hours} is negative
     */
    public static Specification<Order> isDueSoon(Clock clock, int hours) {
        requireNonNull(clock, "clock");
        requireNonNegative(hours, "hours");
        Duration window = Duration.ofHours(hours);
        return rule("order.isDueSoon[" + hours + "h]", o -> {
            if (o.requiredBy() == null) {
                return false;
            }
            Duration remaining = Duration.between(clock.instant(), o.requiredBy());
            return !remaining.isNegative() && !remaining.isZero() && remaining.compareTo(window) <= 0;
        });
    }

    public static Specification<Order> isInternational() {
        return isInternational(DEFAULT_DOMESTIC_COUNTRY);
    }

    /** Satisfied when the destination differs from {@code domesticCountry}, ignoring case. */
    public static Specification<Order> isInternational(String domesticCountry) {
        requireNonBlank(domesticCountry, "domesticCountry");
        return rule(
                "order.isInternational[" + domesticCountry + "]",
                o -> o.destinationCountry() != null && !o.destinationCountry().equalsIgnoreCase(domesticCountry));
    }

    public static Specification<Order> hasShippingMethod(ShippingMethod method) {
        requireNonNull(method, "method");
        return rule("order.hasShippingMethod[" + method + "]", o -> o.shippingMethod() == method);
    }

    /** Packed orders. */
    public static Specification<Order> isReadyToShip() {
        return rule("order.isReadyToShip", o -> o.status() == OrderStatus.PACKED);
    }

    /** Every line fully picked. */
    public static Specification<Order> isCompletelyPicked() {
        return rule(
                "order.isCompletelyPicked", o -> o.lines().stream().allMatch(OrderLine::isFullyPicked));
    }

    /** At least one line with picking started but not finished. */
    public static Specification<Order> hasPartialPicks() {
        return rule(
                "order.hasPartialPicks", o -> o.lines().stream().anyMatch(OrderLine::isPartiallyPicked));
    }

    public static Specification<Order> isLargeOrder() {
        return isLargeOrder(DEFAULT_LARGE_ORDER_LINES);
    }

    /**
     * Satisfied by orders with more than {@code lineThreshold} lines.
     *
     * @throws IllegalArgumentException if {@code lineThreshold} is not positive
     */
    public static Specification<Order> isLargeOrder(int lineThreshold) {
        requirePositive(lineThreshold, "lineThreshold");
        return rule(
                "order.isLargeOrder[" + lineThreshold + "]", o -> o.lines().size() > lineThreshold);
    }

    /**
     * Urgent orders, orders shipping overnight or two-day air, and orders due within
     * {@value #EXPEDITE_WITHIN_HOURS} hours (including overdue ones).
     */
    public static Specification<Order> requiresExpeditedProcessing(Clock clock) {
        requireNonNull(clock, "clock");
        Duration cutoff = Duration.ofHours(EXPEDITE_WITHIN_HOURS);
        return rule("order.requiresExpeditedProcessing", o -> urgent(o)
                || o.shippingMethod() == ShippingMethod.OVERNIGHT
                || o.shippingMethod() == ShippingMethod.TWO_DAY_AIR
                || (o.requiredBy() != null
                        && Duration.between(clock.instant(), o.requiredBy()).compareTo(cutoff) < 0));
    }

    /** Orders placed on the clock's current date, in the clock's zone. */
    public static Specification<Order> isPlacedToday(Clock clock) {
        requireNonNull(clock, "clock");
        return rule("order.isPlacedToday", o -> o.orderedAt() != null
                && LocalDate.ofInstant(o.orderedAt(), clock.getZone()).equals(LocalDate.now(clock)));
    }

    private static boolean urgent(Order order) {
        return order.priority() == OrderPriority.RUSH || order.priority() == OrderPriority.SAME_DAY;
    }
}
