package com.criterion.warehouse.model;

import java.time.Instant;

/**
 * An outbound shipment handed to a carrier.
 *
 * @param id shipment identifier
 * @param orderId order being shipped
 * @param clientId client the order belongs to
 * @param shippedAt when the carrier took the shipment
 * @param carrier carrier name (e.g., "UPS")
 * @param trackingNumber carrier tracking number
 * @param weight total weight in pounds
 * @param status tracking status
 * @param deliveredAt delivery time, or null while undelivered
 */
public record Shipment(
        String id,
        String orderId,
        String clientId,
        Instant shippedAt,
        String carrier,
        String trackingNumber,
        double weight,
        ShipmentStatus status,
        Instant deliveredAt) {}
