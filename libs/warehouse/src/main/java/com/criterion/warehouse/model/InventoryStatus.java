package com.criterion.warehouse.model;

/** Stock status of an inventory record. */
public enum InventoryStatus {
    AVAILABLE,
    RESERVED,
    QUARANTINE,
    DAMAGED,
    EXPIRED,
    IN_TRANSIT
}
