package com.criterion.warehouse.model;

/**
 * One SKU on an order.
 *
 * @param sku product ordered
 * @param quantityOrdered units requested
 * @param quantityPicked units picked so far
 */
public record OrderLine(String sku, int quantityOrdered, int quantityPicked) {

    /** Whether every ordered unit has been picked. */
    public boolean isFullyPicked() {
        return quantityPicked >= quantityOrdered;
    }

    /** Whether picking has started but not finished. */
    public boolean isPartiallyPicked() {
        return quantityPicked > 0 && quantityPicked < quantityOrdered;
    }
}
