package com.criterion.warehouse.model;

/** Carrier service level requested for an order. */
public enum ShippingMethod {
    GROUND,
    TWO_DAY_AIR,
    OVERNIGHT,
    INTERNATIONAL,
    FREIGHT
}
