package com.criterion.warehouse.model;

import java.time.Instant;

/** Factory methods for creating validated {@link Product} and {@link Dimensions} instances. */
public final class ProductFactory {

    private ProductFactory() {
        // utility class
    }

    /** Creates a non-perishable product with no special handling flags. */
    public static Product create(
            String sku,
            String clientId,
            String name,
            ProductCategory category,
            double weight,
            Dimensions dimensions,
            double unitCost) {
        return create(sku, clientId, name, "", category, weight, dimensions, false, false, false, unitCost, null);
    }

    /**
     * Creates a product.
     *
     * @throws IllegalArgumentException listing every validation error
     */
    public static Product create(
            String sku,
            String clientId,
            String name,
            String description,
            ProductCategory category,
            double weight,
            Dimensions dimensions,
            boolean fragile,
            boolean hazmat,
            boolean requiresRefrigeration,
            double unitCost,
            Instant expiresAt) {
        var product = new Product(
                sku,
                clientId,
                name,
                description == null ? "" : description,
                category,
                weight,
                dimensions,
                fragile,
                hazmat,
                requiresRefrigeration,
                unitCost,
                expiresAt);
        WarehouseValidator.validate(product).throwIfInvalid("product " + sku);
        return product;
    }

    /**
     * Creates package dimensions.
     *
     * @throws IllegalArgumentException if any side is not positive
     */
    public static Dimensions dimensions(double length, double width, double height) {
        var dimensions = new Dimensions(length, width, height);
        WarehouseValidator.validate(dimensions).throwIfInvalid("dimensions");
        return dimensions;
    }
}
