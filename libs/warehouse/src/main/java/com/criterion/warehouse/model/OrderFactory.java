package com.criterion.warehouse.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/** Factory methods for creating validated {@link Order} and {@link OrderLine} instances. */
public final class OrderFactory {

    private OrderFactory() {
        // utility class
    }

    /**
     * Creates an order. The line list is copied.
     *
     * @throws IllegalArgumentException listing every validation error, including line errors
     */
    public static Order create(
            String id,
            String clientId,
            Instant orderedAt,
            Instant requiredBy,
            OrderPriority priority,
            ShippingMethod shippingMethod,
            String destinationCountry,
            OrderStatus status,
            List<OrderLine> lines) {
        if (lines != null && lines.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("lines must not contain null");
        }
        var order = new Order(id, clientId, orderedAt, requiredBy, priority, shippingMethod, destinationCountry,
                status, lines);
        WarehouseValidator.validate(order).throwIfInvalid("order " + id);
        return order;
    }

    /** Creates an unpicked order line. */
    public static OrderLine line(String sku, int quantityOrdered) {
        return line(sku, quantityOrdered, 0);
    }

    /**
     * Creates an order line.
     *
     * @throws IllegalArgumentException listing every validation error
     */
    public static OrderLine line(String sku, int quantityOrdered, int quantityPicked) {
        var line = new OrderLine(sku, quantityOrdered, quantityPicked);
        WarehouseValidator.validate(line).throwIfInvalid("order line " + sku);
        return line;
    }
}
