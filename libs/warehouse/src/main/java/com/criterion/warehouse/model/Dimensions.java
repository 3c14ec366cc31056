package com.criterion.warehouse.model;

/**
 * Package dimensions in inches.
 *
 * @param length length
 * @param width width
 * @param height height
 */
public record Dimensions(double length, double width, double height) {

    /** Cubic inches occupied by the package. */
    public double volume() {
        return length * width * height;
    }
}
