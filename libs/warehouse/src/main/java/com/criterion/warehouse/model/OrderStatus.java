package com.criterion.warehouse.model;

/** Fulfilment lifecycle of an order. */
public enum OrderStatus {
    PENDING,
    IN_PROGRESS,
    PICKED,
    PACKED,
    SHIPPED,
    DELIVERED,
    CANCELLED,
    ON_HOLD;

    /** Whether the order has left the warehouse or been abandoned. */
    public boolean isClosed() {
        return this == SHIPPED || this == DELIVERED || this == CANCELLED;
    }
}
