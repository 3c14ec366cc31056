package com.criterion.warehouse.model;

/**
 * A storage slot addressed as zone-aisle-bay-level.
 *
 * @param id location identifier
 * @param zone zone code
 * @param aisle aisle code
 * @param bay bay code
 * @param level shelf level
 * @param type functional area
 * @param temperatureControlled suitable for refrigerated goods
 * @param maxWeight maximum load in pounds
 * @param hazmatApproved certified for hazardous materials
 */
public record Location(
        String id,
        String zone,
        String aisle,
        String bay,
        String level,
        LocationType type,
        boolean temperatureControlled,
        double maxWeight,
        boolean hazmatApproved) {

    /** Human-readable address, e.g. {@code A-01-01-1}. */
    public String address() {
        return String.join("-", zone, aisle, bay, level);
    }
}
