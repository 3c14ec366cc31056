package com.criterion.warehouse.model;

import java.time.Instant;

/** Factory methods for creating validated {@link Shipment} instances. */
public final class ShipmentFactory {

    private ShipmentFactory() {
        // utility class
    }

    /** Creates a freshly created, undelivered shipment. */
    public static Shipment create(
            String id,
            String orderId,
            String clientId,
            Instant shippedAt,
            String carrier,
            String trackingNumber,
            double weight) {
        return create(id, orderId, clientId, shippedAt, carrier, trackingNumber, weight, ShipmentStatus.CREATED, null);
    }

    /**
     * Creates a shipment.
     *
     * @throws IllegalArgumentException listing every validation error
     */
    public static Shipment create(
            String id,
            String orderId,
            String clientId,
            Instant shippedAt,
            String carrier,
            String trackingNumber,
            double weight,
            ShipmentStatus status,
            Instant deliveredAt) {
        var shipment = new Shipment(id, orderId, clientId, shippedAt, carrier, trackingNumber, weight, status,
                deliveredAt);
        WarehouseValidator.validate(shipment).throwIfInvalid("shipment " + id);
        return shipment;
    }
}
