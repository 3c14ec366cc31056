package com.criterion.warehouse.model;

/** Product classification used for slotting and reporting. */
public enum ProductCategory {
    AUTOMOTIVE,
    BEAUTY,
    ELECTRONICS,
    FOOD,
    APPAREL,
    INDUSTRIAL,
    GENERAL
}
