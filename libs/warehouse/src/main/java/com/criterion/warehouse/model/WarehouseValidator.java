package com.criterion.warehouse.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates warehouse records for required fields and consistent values.
 *
 * <p>Every check runs, so a {@link ValidationResult} lists all problems with a record at once.
 * The factories in this package call the validator before handing out a record, and loaders
 * call it on data they did not build themselves.
 */
public final class WarehouseValidator {

    private WarehouseValidator() {
        // utility class
    }

    public static ValidationResult validate(Client client) {
        var errors = new ArrayList<String>();
        requireText(errors, "id", client.id());
        requireText(errors, "name", client.name());
        requireText(errors, "contactEmail", client.contactEmail());
        requirePresent(errors, "tier", client.tier());
        requirePresent(errors, "contractStart", client.contractStart());
        if (client.contractStart() != null
                && client.contractEnd() != null
                && !client.contractEnd().isAfter(client.contractStart())) {
            errors.add("contractEnd must be after contractStart");
        }
        return ValidationResult.of(errors);
    }

    public static ValidationResult validate(Product product) {
        var errors = new ArrayList<String>();
        requireText(errors, "sku", product.sku());
        requireText(errors, "clientId", product.clientId());
        requireText(errors, "name", product.name());
        requirePresent(errors, "category", product.category());
        if (product.weight() <= 0) {
            errors.add("weight must be > 0");
        }
        if (product.unitCost() < 0) {
            errors.add("unitCost must be >= 0");
        }
        if (product.dimensions() == null) {
            errors.add("dimensions must not be null");
        } else {
            errors.addAll(validate(product.dimensions()).errors());
        }
        return ValidationResult.of(errors);
    }

    public static ValidationResult validate(Dimensions dimensions) {
        if (dimensions.length() <= 0 || dimensions.width() <= 0 || dimensions.height() <= 0) {
            return ValidationResult.fail(List.of("dimensions must all be > 0"));
        }
        return ValidationResult.ok();
    }

    public static ValidationResult validate(Inventory inventory) {
        var errors = new ArrayList<String>();
        requireText(errors, "id", inventory.id());
        requireText(errors, "sku", inventory.sku());
        requireText(errors, "clientId", inventory.clientId());
        requireText(errors, "locationId", inventory.locationId());
        requirePresent(errors, "lastCountedAt", inventory.lastCountedAt());
        requirePresent(errors, "status", inventory.status());
        if (inventory.quantity() < 0) {
            errors.add("quantity must be >= 0");
        }
        if (inventory.reorderPoint() < 0) {
            errors.add("reorderPoint must be >= 0");
        }
        if (inventory.maxQuantity() < inventory.reorderPoint()) {
            errors.add("maxQuantity must be >= reorderPoint");
        }
        return ValidationResult.of(errors);
    }

    public static ValidationResult validate(Location location) {
        var errors = new ArrayList<String>();
        requireText(errors, "id", location.id());
        requireText(errors, "zone", location.zone());
        requireText(errors, "aisle", location.aisle());
        requireText(errors, "bay", location.bay());
        requireText(errors, "level", location.level());
        requirePresent(errors, "type", location.type());
        if (location.maxWeight() <= 0) {
            errors.add("maxWeight must be > 0");
        }
        return ValidationResult.of(errors);
    }

    public static ValidationResult validate(Order order) {
        var errors = new ArrayList<String>();
        requireText(errors, "id", order.id());
        requireText(errors, "clientId", order.clientId());
        requireText(errors, "destinationCountry", order.destinationCountry());
        requirePresent(errors, "orderedAt", order.orderedAt());
        requirePresent(errors, "requiredBy", order.requiredBy());
        requirePresent(errors, "priority", order.priority());
        requirePresent(errors, "shippingMethod", order.shippingMethod());
        requirePresent(errors, "status", order.status());
        if (order.orderedAt() != null
                && order.requiredBy() != null
                && order.requiredBy().isBefore(order.orderedAt())) {
            errors.add("requiredBy must be on or after orderedAt");
        }
        if (order.lines().isEmpty()) {
            errors.add("lines must contain at least one order line");
        }
        for (int i = 0; i < order.lines().size(); i++) {
            for (String error : validate(order.lines().get(i)).errors()) {
                errors.add("lines[" + i + "]." + error);
            }
        }
        return ValidationResult.of(errors);
    }

    public static ValidationResult validate(OrderLine line) {
        var errors = new ArrayList<String>();
        requireText(errors, "sku", line.sku());
        if (line.quantityOrdered() <= 0) {
            errors.add("quantityOrdered must be > 0");
        }
        if (line.quantityPicked() < 0) {
            errors.add("quantityPicked must be >= 0");
        }
        if (line.quantityPicked() > line.quantityOrdered()) {
            errors.add("quantityPicked must not exceed quantityOrdered");
        }
        return ValidationResult.of(errors);
    }

    public static ValidationResult validate(Shipment shipment) {
        var errors = new ArrayList<String>();
        requireText(errors, "id", shipment.id());
        requireText(errors, "orderId", shipment.orderId());
        requireText(errors, "clientId", shipment.clientId());
        requireText(errors, "carrier", shipment.carrier());
        requireText(errors, "trackingNumber", shipment.trackingNumber());
        requirePresent(errors, "shippedAt", shipment.shippedAt());
        requirePresent(errors, "status", shipment.status());
        if (shipment.weight() <= 0) {
            errors.add("weight must be > 0");
        }
        if (shipment.shippedAt() != null
                && shipment.deliveredAt() != null
                && shipment.deliveredAt().isBefore(shipment.shippedAt())) {
            errors.add("deliveredAt must not be before shippedAt");
        }
        return ValidationResult.of(errors);
    }

    private static void requireText(List<String> errors, String field, String value) {
        if (value == null || value.isBlank()) {
            errors.add(field + " must not be null or blank");
        }
    }

    private static void requirePresent(List<String> errors, String field, Object value) {
        if (value == null) {
            errors.add(field + " must not be null");
        }
    }
}
