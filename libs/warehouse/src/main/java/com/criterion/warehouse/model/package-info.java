/**
 * Warehouse (3PL) domain records, their validator and validating factories.
 */
package com.criterion.warehouse.model;
