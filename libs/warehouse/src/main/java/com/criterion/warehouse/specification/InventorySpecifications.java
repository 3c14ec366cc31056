package com.criterion.warehouse.specification;

import static com.criterion.warehouse.specification.Arguments.requireNonBlank;
import static com.criterion.warehouse.specification.Arguments.requireNonNegative;
import static com.criterion.warehouse.specification.Arguments.requireNonNull;
import static com.criterion.warehouse.specification.Rules.rule;

import com.criterion.specification.Specification;
import com.criterion.warehouse.model.Inventory;
import com.criterion.warehouse.model.InventoryStatus;
import java.time.Clock;
import java.time.Duration;

/** Rules over {@link Inventory} candidates. */
public final class InventorySpecifications {

    public static final double DEFAULT_CAPACITY_THRESHOLD = 0.9;

    private InventorySpecifications() {
        // utility class
    }

    public static Specification<Inventory> belongsToClient(String clientId) {
        requireNonBlank(clientId, "clientId");
        return rule(
                "inventory.belongsToClient[" + clientId + "]", i -> clientId.equals(i.clientId()));
    }

    /** Available stock at or below its reorder point. */
    public static Specification<Inventory> isBelowReorderPoint() {
        return rule(
                "inventory.isBelowReorderPoint",
                i -> i.quantity() <= i.reorderPoint() && i.status() == InventoryStatus.AVAILABLE);
    }

    public static Specification<Inventory> isOutOfStock() {
        return rule("inventory.isOutOfStock", i -> i.quantity() == 0);
    }

    public static Specification<Inventory> isNearCapacity() {
        return isNearCapacity(DEFAULT_CAPACITY_THRESHOLD);
    }

    /**
     * Satisfied when {@code quantity / maxQuantity >= threshold}. A slot with zero capacity is
     * never near capacity.
     *
     * @throws IllegalArgumentException if {@code threshold} is outside {@code [0, 1]}
     */
    public static Specification<Inventory> isNearCapacity(double threshold) {
        if (threshold < 0 || threshold > 1) {
            throw new IllegalArgumentException("threshold must be between 0 and 1 (was " + threshold + ")");
        }
        return rule("inventory.isNearCapacity[" + threshold + "]", i -> i.maxQuantity() != 0
                && (double) i.quantity() / i.maxQuantity() >= threshold);
    }

    public static Specification<Inventory> hasStatus(InventoryStatus status) {
        requireNonNull(status, "status");
        return rule("inventory.hasStatus[" + status + "]", i -> i.status() == status);
    }

    /** Quarantined stock whose quarantine period has not yet ended. */
    public static Specification<Inventory> isInQuarantine(Clock clock) {
        requireNonNull(clock, "clock");
        return rule("inventory.isInQuarantine", i -> i.status() == InventoryStatus.QUARANTINE
                && i.quarantineUntil() != null
                && i.quarantineUntil().isAfter(clock.instant()));
    }

    /** Quarantined stock whose quarantine period has ended. */
    public static Specification<Inventory> canReleaseFromQuarantine(Clock clock) {
        requireNonNull(clock, "clock");
        return rule(
                "inventory.canReleaseFromQuarantine", i -> i.status() == InventoryStatus.QUARANTINE
                        && i.quarantineUntil() != null
                        && !i.quarantineUntil().isAfter(clock.instant()));
    }

    /**
     * Satisfied when more than {@code days} whole days have passed since the last cycle count.
     *
     * @throws IllegalArgumentException if {@code days} is negative
     */
    public static Specification<Inventory> needsCycleCount(Clock clock, int days) {
        requireNonNull(clock, "clock");
        requireNonNegative(days, "days");
        return rule("inventory.needsCycleCount[" + days + "d]", i -> i.lastCountedAt() != null
                && Duration.between(i.lastCountedAt(), clock.instant()).toDays() > days);
    }

    /** Available stock with at least one unit on hand. */
    public static Specification<Inventory> isAvailable() {
        return rule(
                "inventory.isAvailable", i -> i.status() == InventoryStatus.AVAILABLE && i.quantity() > 0);
    }

    public static Specification<Inventory> isAtLocation(String locationId) {
        requireNonBlank(locationId, "locationId");
        return rule(
                "inventory.isAtLocation[" + locationId + "]", i -> locationId.equals(i.locationId()));
    }

    /** Damaged or expired stock, or available stock that has run out. */
    public static Specification<Inventory> requiresImmediateAttention() {
        return rule(
                "inventory.requiresImmediateAttention",
                i -> i.status() == InventoryStatus.DAMAGED
                        || i.status() == InventoryStatus.EXPIRED
                        || (i.quantity() == 0 && i.status() == InventoryStatus.AVAILABLE));
    }
}
