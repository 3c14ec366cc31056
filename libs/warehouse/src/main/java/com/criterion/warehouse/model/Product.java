package com.criterion.warehouse.model;

import java.time.Instant;

/**
 * A SKU stored in the warehouse on behalf of a client.
 *
 * @param sku stock keeping unit
 * @param clientId owning client
 * @param name product name
 * @param description free-text description
 * @param category product category
 * @param weight unit weight in pounds
 * @param dimensions unit package dimensions
 * @param fragile needs careful handling
 * @param hazmat hazardous material
 * @param requiresRefrigeration must be stored in a temperature-controlled location
 * @param unitCost declared value per unit
 * @param expiresAt expiration date, or null for non-perishable goods
 */
public record Product(
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
        Instant expiresAt) {}
