package com.criterion.warehouse.specification;

import static com.criterion.warehouse.specification.Arguments.requireNonNegative;
import static com.criterion.warehouse.specification.Arguments.requireNonNull;
import static com.criterion.warehouse.specification.Rules.rule;

import com.criterion.specification.Specification;
import com.criterion.warehouse.model.Location;
import com.criterion.warehouse.model.LocationType;
import com.criterion.warehouse.model.Product;

/** Rules over {@link Location} candidates, including slotting checks for a product. */
public final class LocationSpecifications {

    private LocationSpecifications() {
        // utility class
    }

    public static Specification<Location> isHazmatApproved() {
        return rule("location.isHazmatApproved", Location::hazmatApproved);
    }

    public static Specification<Location> isTemperatureControlled() {
        return rule("location.isTemperatureControlled", Location::temperatureControlled);
    }

    /** Satisfied when the location's weight limit is at least {@code weight}. */
    public static Specification<Location> canHold(double weight) {
        requireNonNegative(weight, "weight");
        return rule("location.canHold[" + weight + "]", l -> l.maxWeight() >= weight);
    }

    public static Specification<Location> isType(LocationType type) {
        requireNonNull(type, "type");
        return rule("location.isType[" + type + "]", l -> l.type() == type);
    }

    /**
     * Satisfied by locations where {@code product} may be slotted: hazmat goods need a hazmat
     * approved location, refrigerated goods a temperature-controlled one, and the unit weight
     * must be within the location's limit.
     */
    public static Specification<Location> canStore(Product product) {
        requireNonNull(product, "product");
        Specification<Location> spec = canHold(product.weight());
        if (product.hazmat()) {
            spec = spec.and(isHazmatApproved());
        }
        if (product.requiresRefrigeration()) {
            spec = spec.and(isTemperatureControlled());
        }
        return rule("location.canStore[" + product.sku() + "]", spec);
    }
}
