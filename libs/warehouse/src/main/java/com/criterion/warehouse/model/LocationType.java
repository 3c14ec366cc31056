package com.criterion.warehouse.model;

/** Functional area a warehouse location belongs to. */
public enum LocationType {
    RECEIVING,
    STORAGE,
    PICKING,
    PACKING,
    SHIPPING,
    QUARANTINE,
    RETURNS
}
