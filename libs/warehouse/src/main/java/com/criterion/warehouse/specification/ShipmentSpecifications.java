package com.criterion.warehouse.specification;

import static com.criterion.warehouse.specification.Arguments.requireNonBlank;
import static com.criterion.warehouse.specification.Arguments.requireNonNull;
import static com.criterion.warehouse.specification.Arguments.requirePositive;
import static com.criterion.warehouse.specification.Rules.rule;

import com.criterion.specification.Specification;
import com.criterion.warehouse.model.Shipment;
import com.criterion.warehouse.model.ShipmentStatus;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;

/** Rules over {@link Shipment} candidates. */
public final class ShipmentSpecifications {

    public static final int DEFAULT_EXPECTED_DELIVERY_DAYS = 7;
    public static final double DEFAULT_HEAVY_WEIGHT = 150;

    private ShipmentSpecifications() {
        // utility class
    }

    public static Specification<Shipment> belongsToClient(String clientId) {
        requireNonBlank(clientId, "clientId");
        return rule(
                "shipment.belongsToClient[" + clientId + "]", s -> clientId.equals(s.clientId()));
    }

    public static Specification<Shipment> hasStatus(ShipmentStatus status) {
        requireNonNull(status, "status");
        return rule("shipment.hasStatus[" + status + "]", s -> s.status() == status);
    }

    /** Satisfied when the carrier matches, ignoring case. */
    public static Specification<Shipment> isCarrier(String carrier) {
        requireNonBlank(carrier, "carrier");
        return rule("shipment.isCarrier[" + carrier + "]", s -> carrier.equalsIgnoreCase(s.carrier()));
    }

    /** Delayed shipments and carrier exceptions. */
    public static Specification<Shipment> isDelayed() {
        return rule("shipment.isDelayed",
                s -> s.status() == ShipmentStatus.DELAYED || s.status() == ShipmentStatus.EXCEPTION);
    }

    /** In transit or out for delivery. */
    public static Specification<Shipment> isInTransit() {
        return rule("shipment.isInTransit",
                s -> s.status() == ShipmentStatus.IN_TRANSIT || s.status() == ShipmentStatus.OUT_FOR_DELIVERY);
    }

    /** Delivered with a recorded delivery time. */
    public static Specification<Shipment> isDelivered() {
        return rule(
                "shipment.isDelivered", s -> s.status() == ShipmentStatus.DELIVERED && s.deliveredAt() != null);
    }

    /**
     * Satisfied by shipments shipped within {@code [start, end]}, both ends inclusive.
     *
     * @throws IllegalArgumentException if either bound is null or {@code end} is before {@code start}
     */
    public static Specification<Shipment> isShippedBetween(Instant start, Instant end) {
        requireNonNull(start, "start");
        requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("end must not be before start (start=" + start + ", end=" + end + ")");
        }
        return rule("shipment.isShippedBetween[" + start + ", " + end + "]", s -> s.shippedAt() != null
                && !s.shippedAt().isBefore(start)
                && !s.shippedAt().isAfter(end));
    }

    public static Specification<Shipment> hasLongDeliveryTime() {
        return hasLongDeliveryTime(DEFAULT_EXPECTED_DELIVERY_DAYS);
    }

    /**
     * Satisfied by delivered shipments that took more than {@code expectedDays} whole days.
     *
     * @throws IllegalArgumentException if {@code expectedDays} is not positive
     */
    public static Specification<Shipment> hasLongDeliveryTime(int expectedDays) {
        requirePositive(expectedDays, "expectedDays");
        return rule("shipment.hasLongDeliveryTime[" + expectedDays + "d]", s -> s.shippedAt() != null
                && s.deliveredAt() != null
                && Duration.between(s.shippedAt(), s.deliveredAt()).toDays() > expectedDays);
    }

    public static Specification<Shipment> isHeavy() {
        return isHeavy(DEFAULT_HEAVY_WEIGHT);
    }

    /**
     * Satisfied by shipments strictly heavier than {@code threshold} pounds.
     *
     * @throws IllegalArgumentException if {@code threshold} is not positive
     */
    public static Specification<Shipment> isHeavy(double threshold) {
        requirePositive(threshold, "threshold");
        return rule("shipment.isHeavy[" + threshold + "]", s -> s.weight() > threshold);
    }

    public static Specification<Shipment> isReturned() {
        return rule("shipment.isReturned", s -> s.status() == ShipmentStatus.RETURNED);
    }

    /** Shipments that left on the clock's current date, in the clock's zone. */
    public static Specification<Shipment> isShippedToday(Clock clock) {
        requireNonNull(clock, "clock");
        return rule("shipment.isShippedToday", s -> s.shippedAt() != null
                && LocalDate.ofInstant(s.shippedAt(), clock.getZone()).equals(LocalDate.now(clock)));
    }

    /** Delayed, exception or returned shipments. */
    public static Specification<Shipment> hasDeliveryIssues() {
        return rule("shipment.hasDeliveryIssues",
                s -> s.status() == ShipmentStatus.DELAYED
                        || s.status() == ShipmentStatus.EXCEPTION
                        || s.status() == ShipmentStatus.RETURNED);
    }
}
