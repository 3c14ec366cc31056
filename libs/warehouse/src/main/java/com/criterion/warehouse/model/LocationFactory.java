package com.criterion.warehouse.model;

/** Factory methods for creating validated {@link Location} instances. */
public final class LocationFactory {

    private LocationFactory() {
        // utility class
    }

    /**
     * Creates a location.
     *
     * @throws IllegalArgumentException listing every validation error
     */
    public static Location create(
            String id,
            String zone,
            String aisle,
            String bay,
            String level,
            LocationType type,
            boolean temperatureControlled,
            double maxWeight,
            boolean hazmatApproved) {
        var location = new Location(id, zone, aisle, bay, level, type, temperatureControlled, maxWeight, hazmatApproved);
        WarehouseValidator.validate(location).throwIfInvalid("location " + id);
        return location;
    }
}
