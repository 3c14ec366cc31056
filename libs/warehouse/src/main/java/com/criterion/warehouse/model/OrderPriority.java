package com.criterion.warehouse.model;

/** Fulfilment priority, lowest first. */
public enum OrderPriority {
    LOW,
    NORMAL,
    HIGH,
    RUSH,
    SAME_DAY
}
