package com.criterion.warehouse.specification;

import static com.criterion.warehouse.specification.Arguments.requireNonBlank;
import static com.criterion.warehouse.specification.Arguments.requireNonNegative;
import static com.criterion.warehouse.specification.Arguments.requireNonNull;
import static com.criterion.warehouse.specification.Rules.rule;

import com.criterion.specification.Specification;
import com.criterion.warehouse.model.Product;
import com.criterion.warehouse.model.ProductCategory;
import java.time.Clock;
import java.time.Duration;

/**
 * Rules over {@link Product} candidates.
 *
 * <p>Perishability is driven by {@link Product#expiresAt()}: a product without an expiration date
 * is never expired or expiring.
 */
public final class ProductSpecifications {

    public static final double DEFAULT_HIGH_VALUE_THRESHOLD = 1000;
    public static final double DEFAULT_OVERSIZED_VOLUME = 10000;

    private ProductSpecifications() {
        // utility class
    }

    public static Specification<Product> belongsToClient(String clientId) {
        requireNonBlank(clientId, "clientId");
        return rule(
                "product.belongsToClient[" + clientId + "]", p -> clientId.equals(p.clientId()));
    }

    public static Specification<Product> isHazmat() {
        return rule("product.isHazmat", Product::hazmat);
    }

    public static Specification<Product> isFragile() {
        return rule("product.isFragile", Product::fragile);
    }

    public static Specification<Product> requiresRefrigeration() {
        return rule("product.requiresRefrigeration", Product::requiresRefrigeration);
    }

    public static Specification<Product> isPerishable() {
        return rule("product.isPerishable", p -> p.expiresAt() != null);
    }

    public static Specification<Product> isExpired(Clock clock) {
        requireNonNull(clock, "clock");
        return rule(
                "product.isExpired", p -> p.expiresAt() != null && p.expiresAt().isBefore(clock.instant()));
    }

    /**
     * Satisfied when the product expires within {@code days} whole days from now.
     *
     * @throws IllegalArgumentException if {@code days} is negative
     */
    public static Specification<Product> isExpiring(Clock clock, int days) {
        requireNonNull(clock, "clock");
        requireNonNegative(days, "days");
        return rule("product.isExpiring[" + days + "d]", p -> {
            if (p.expiresAt() == null) {
                return false;
            }
            long daysRemaining = Duration.between(clock.instant(), p.expiresAt()).toDays();
            return daysRemaining >= 0 && daysRemaining <= days;
        });
    }

    public static Specification<Product> isCategory(ProductCategory category) {
        requireNonNull(category, "category");
        return rule("product.isCategory[" + category + "]", p -> p.category() == category);
    }

    /** Satisfied by products strictly heavier than {@code threshold} pounds. */
    public static Specification<Product> exceedsWeight(double threshold) {
        requireNonNegative(threshold, "threshold");
        return rule("product.exceedsWeight[" + threshold + "]", p -> p.weight() > threshold);
    }

    public static Specification<Product> isHighValue() {
        return isHighValue(DEFAULT_HIGH_VALUE_THRESHOLD);
    }

    /** Satisfied by products whose unit cost is strictly above {@code threshold}. */
    public static Specification<Product> isHighValue(double threshold) {
        requireNonNegative(threshold, "threshold");
        return rule("product.isHighValue[" + threshold + "]", p -> p.unitCost() > threshold);
    }

    /** Hazmat, fragile or refrigerated goods. */
    public static Specification<Product> requiresSpecialHandling() {
        return rule(
                "product.requiresSpecialHandling", p -> p.hazmat() || p.fragile() || p.requiresRefrigeration());
    }

    public static Specification<Product> isOversized() {
        return isOversized(DEFAULT_OVERSIZED_VOLUME);
    }

    /** Satisfied by products whose package volume is strictly above {@code volume}. */
    public static Specification<Product> isOversized(double volume) {
        requireNonNegative(volume, "volume");
        return rule(
                "product.isOversized[" + volume + "]",
                p -> p.dimensions() != null && p.dimensions().volume() > volume);
    }
}
