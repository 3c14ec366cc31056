package com.criterion.warehouse.model;

/** Service tier a client has contracted for. */
public enum ClientTier {
    STANDARD,
    PREMIUM,
    ENTERPRISE
}
