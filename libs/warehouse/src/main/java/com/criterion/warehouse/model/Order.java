package com.criterion.warehouse.model;

import java.time.Instant;
import java.util.List;

/**
 * A customer order to be fulfilled from the warehouse.
 *
 * @param id order identifier
 * @param clientId client the order belongs to
 * @param orderedAt when the order was placed
 * @param requiredBy when the order must ship
 * @param priority fulfilment priority
 * @param shippingMethod carrier service level
 * @param destinationCountry destination country name or code
 * @param status fulfilment status
 * @param lines order lines (at least one)
 */
public record Order(
        String id,
        String clientId,
        Instant orderedAt,
        Instant requiredBy,
        OrderPriority priority,
        ShippingMethod shippingMethod,
        String destinationCountry,
        OrderStatus status,
        List<OrderLine> lines) {

    public Order {
        lines = lines == null ? List.of() : List.copyOf(lines);
    }
}
