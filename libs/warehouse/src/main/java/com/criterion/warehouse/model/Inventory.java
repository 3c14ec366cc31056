package com.criterion.warehouse.model;

import java.time.Instant;

/**
 * Stock of one SKU at one warehouse location.
 *
 * @param id inventory record identifier
 * @param sku product stored
 * @param clientId owning client
 * @param locationId storage location
 * @param quantity units on hand
 * @param reorderPoint quantity at or below which stock should be replenished
 * @param maxQuantity capacity of the slot for this SKU
 * @param lastCountedAt last cycle count
 * @param status stock status
 * @param quarantineUntil end of quarantine, or null when not quarantined
 */
public record Inventory(
        String id,
        String sku,
        String clientId,
        String locationId,
        int quantity,
        int reorderPoint,
        int maxQuantity,
        Instant lastCountedAt,
        InventoryStatus status,
        Instant quarantineUntil) {}
