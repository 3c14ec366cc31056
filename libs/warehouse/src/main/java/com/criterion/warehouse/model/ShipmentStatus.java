package com.criterion.warehouse.model;

/** Carrier tracking status of a shipment. */
public enum ShipmentStatus {
    CREATED,
    PICKED_UP,
    IN_TRANSIT,
    OUT_FOR_DELIVERY,
    DELIVERED,
    DELAYED,
    EXCEPTION,
    RETURNED
}
