package com.criterion.warehouse.model;

import java.time.Instant;

/** Factory methods for creating validated {@link Inventory} instances. */
public final class InventoryFactory {

    private InventoryFactory() {
        // utility class
    }

    /** Creates available, unquarantined stock. */
    public static Inventory create(
            String id,
            String sku,
            String clientId,
            String locationId,
            int quantity,
            int reorderPoint,
            int maxQuantity,
            Instant lastCountedAt) {
        return create(id, sku, clientId, locationId, quantity, reorderPoint, maxQuantity, lastCountedAt,
                InventoryStatus.AVAILABLE, null);
    }

    /**
     * Creates an inventory record.
     *
     * @throws IllegalArgumentException listing every validation error
     */
    public static Inventory create(
            String id,
            String sku,
            String clientId,
            String locationId,
            int quantity,
            int reorderPoint,
            int maxQuantity,
            Instant lastCountedAt,
            InventoryStatus status,
            Instant quarantineUntil) {
        var inventory = new Inventory(id, sku, clientId, locationId, quantity, reorderPoint, maxQuantity,
                lastCountedAt, status, quarantineUntil);
        WarehouseValidator.validate(inventory).throwIfInvalid("inventory " + id);
        return inventory;
    }
}
