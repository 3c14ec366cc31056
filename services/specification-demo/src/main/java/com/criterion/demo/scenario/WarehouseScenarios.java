package com.criterion.demo.scenario;

import static com.criterion.specification.collection.SpecificationFilters.any;
import static com.criterion.specification.collection.SpecificationFilters.firstOrDefault;
import static com.criterion.specification.collection.SpecificationFilters.stream;
import static com.criterion.specification.collection.SpecificationFilters.toList;

import com.criterion.demo.config.DemoProperties;
import com.criterion.demo.data.WarehouseDataset;
import com.criterion.specification.Specification;
import com.criterion.warehouse.model.Client;
import com.criterion.warehouse.model.Inventory;
import com.criterion.warehouse.model.Location;
import com.criterion.warehouse.model.Order;
import com.criterion.warehouse.model.OrderLine;
import com.criterion.warehouse.model.OrderStatus;
import com.criterion.warehouse.model.Product;
import com.criterion.warehouse.model.Shipment;
import com.criterion.warehouse.model.ShippingMethod;
import com.criterion.warehouse.specification.ClientSpecifications;
import com.criterion.warehouse.specification.InventorySpecifications;
import com.criterion.warehouse.specification.LocationSpecifications;
import com.criterion.warehouse.specification.OrderSpecifications;
import com.criterion.warehouse.specification.ProductSpecifications;
import com.criterion.warehouse.specification.ShipmentSpecifications;
import java.io.PrintStream;
import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Third-party logistics scenarios run against the loaded {@link WarehouseDataset}.
 *
 * <p>Each scenario has a query method returning its result and a report method printing it; the
 * query methods compose rules from the warehouse catalogues and filter through {@link
 * com.criterion.specification.collection.SpecificationFilters}. Time-based rules use the
 * injected {@link Clock}.
 */
@Component
public class WarehouseScenarios {

    static final int HIGH_PRIORITY_EXPIRY_DAYS = 7;
    static final int CYCLE_COUNT_LIMIT = 10;
    static final int LOCATION_SUGGESTIONS = 3;

    private final WarehouseDataset dataset;
    private final Clock clock;
    private final DemoProperties properties;

    public WarehouseScenarios(WarehouseDataset dataset, Clock clock, DemoProperties properties) {
        this.dataset = dataset;
        this.clock = clock;
        this.properties = properties;
    }

    /** Products grouped by urgency of their expiration date. */
    public record ExpiryReport(List<Product> expired, List<Product> expiringSoon, List<Product> expiringLater) {}

    /** A stock record due for a cycle count, with the context used to rank it. */
    public record CycleCount(Inventory inventory, Optional<Client> client, Optional<Product> product, long daysSinceCount) {}

    /** Export checks for one international order. */
    public record ComplianceReview(Order order, boolean containsHazmat, boolean containsPerishable) {

        public boolean hasIssues() {
            return containsHazmat || containsPerishable;
        }
    }

    public List<Scenario> scenarios() {
        return List.of(
                new Scenario("Low Stock Alert for Premium Clients", this::printLowStock),
                new Scenario("Expedited Order Processing", this::printExpeditedOrders),
                new Scenario("Special Handling Location Assignment", this::printSpecialHandling),
                new Scenario("Expiring Inventory Management", this::printExpiryReport),
                new Scenario("Order Batching", this::printBatches),
                new Scenario("SLA Compliance Monitoring", this::printDeliveryIssues),
                new Scenario("Cycle Count Prioritization", this::printCycleCounts),
                new Scenario("International Shipment Compliance", this::printCompliance));
    }

    /** Low or empty stock per active premium or enterprise client. Clients with none are omitted. */
    public Map<Client, List<Inventory>> lowStockForPremiumClients() {
        var premiumActive = ClientSpecifications.isPremiumOrEnterprise().and(ClientSpecifications.isActive());
        var lowStock = InventorySpecifications.isBelowReorderPoint().or(InventorySpecifications.isOutOfStock());

        var result = new LinkedHashMap<Client, List<Inventory>>();
        for (Client client : toList(dataset.clients(), premiumActive)) {
            var items = toList(dataset.inventory(), lowStock.and(InventorySpecifications.belongsToClient(client.id())));
            if (!items.isEmpty()) {
                result.put(client, items);
            }
        }
        return result;
    }

    /** Pending orders that need expedited handling, earliest due first. */
    public List<Order> expeditedPendingOrders() {
        var rule = OrderSpecifications.requiresExpeditedProcessing(clock)
                .and(OrderSpecifications.hasStatus(OrderStatus.PENDING));
        return stream(dataset.orders(), rule)
                .sorted(Comparator.comparing(Order::requiredBy))
                .collect(Collectors.toList());
    }

    /** Each product needing special handling, with the locations able to store it. */
    public Map<Product, List<Location>> specialHandlingPlacements() {
        var result = new LinkedHashMap<Product, List<Location>>();
        for (Product product : toList(dataset.products(), ProductSpecifications.requiresSpecialHandling())) {
            result.put(product, toList(dataset.locations(), LocationSpecifications.canStore(product)));
        }
        return result;
    }

    public ExpiryReport expiryReport() {
        var expired = ProductSpecifications.isExpired(clock);
        var withinWeek = ProductSpecifications.isExpiring(clock, HIGH_PRIORITY_EXPIRY_DAYS);
        var withinWindow = ProductSpecifications.isExpiring(clock, properties.expiringDays());
        return new ExpiryReport(
                toList(dataset.products(), expired),
                toList(dataset.products(), withinWeek.andNot(expired)),
                toList(dataset.products(), withinWindow.andNot(withinWeek)));
    }

    /** Pending, non-urgent ground orders grouped by client. */
    public Map<String, List<Order>> orderBatches() {
        var batchable = OrderSpecifications.hasStatus(OrderStatus.PENDING)
                .and(OrderSpecifications.hasShippingMethod(ShippingMethod.GROUND))
                .and(OrderSpecifications.isUrgent().not());
        return stream(dataset.orders(), batchable)
                .collect(Collectors.groupingBy(Order::clientId, LinkedHashMap::new, Collectors.toList()));
    }

    /** Shipments with delivery issues, ordered by status. */
    public List<Shipment> deliveryIssues() {
        return stream(dataset.shipments(), ShipmentSpecifications.hasDeliveryIssues())
                .sorted(Comparator.comparing(Shipment::status))
                .collect(Collectors.toList());
    }

    /**
     * Available stock overdue for a count, ranked by client tier, then unit cost, then days since
     * the last count. At most {@value #CYCLE_COUNT_LIMIT} entries.
     */
    public List<CycleCount> cycleCountPriorities() {
        var rule = InventorySpecifications.needsCycleCount(clock, properties.cycleCountDays())
                .and(InventorySpecifications.isAvailable());
        Comparator<CycleCount> byTier = Comparator.comparingInt(c -> c.client().map(cl -> cl.tier().ordinal()).orElse(-1));
        Comparator<CycleCount> byValue = Comparator.comparingDouble(c -> c.product().map(Product::unitCost).orElse(0.0));
        return stream(dataset.inventory(), rule)
                .map(this::toCycleCount)
                .sorted(byTier.reversed()
                        .thenComparing(byValue.reversed())
                        .thenComparing(Comparator.comparingLong(CycleCount::daysSinceCount).reversed()))
                .limit(CYCLE_COUNT_LIMIT)
                .collect(Collectors.toList());
    }

    /** International orders with their hazmat and perishable checks. */
    public List<ComplianceReview> internationalCompliance() {
        return stream(dataset.orders(), OrderSpecifications.isInternational(properties.domesticCountry()))
                .map(this::review)
                .collect(Collectors.toList());
    }

    private CycleCount toCycleCount(Inventory inventory) {
        long days = Duration.between(inventory.lastCountedAt(), clock.instant()).toDays();
        return new CycleCount(inventory, dataset.client(inventory.clientId()), dataset.product(inventory.sku()), days);
    }

    private ComplianceReview review(Order order) {
        var products = order.lines().stream()
                .map(OrderLine::sku)
                .map(dataset::product)
                .flatMap(Optional::stream)
                .collect(Collectors.toList());
        return new ComplianceReview(
                order,
                any(products, ProductSpecifications.isHazmat()),
                any(products, ProductSpecifications.isPerishable()));
    }

    private Optional<Inventory> stockOf(Product product) {
        Specification<Inventory> inStock = i -> i.sku().equals(product.sku()) && i.quantity() > 0;
        return firstOrDefault(dataset.inventory(), inStock);
    }

    private long daysUntilExpiry(Product product) {
        return Duration.between(clock.instant(), product.expiresAt()).toDays();
    }

    private void printLowStock(PrintStream out) {
        var lowStock = lowStockForPremiumClients();
        if (lowStock.isEmpty()) {
            out.println("No premium clients with low stock.");
            return;
        }
        out.println("Premium clients with low stock items:");
        lowStock.forEach((client, items) -> {
            out.printf("%n  Client: %s (Tier: %s)%n", client.name(), client.tier());
            items.forEach(i -> out.printf("    - SKU: %s, Qty: %d, Reorder Point: %d%n",
                    i.sku(), i.quantity(), i.reorderPoint()));
        });
    }

    private void printExpeditedOrders(PrintStream out) {
        var orders = expeditedPendingOrders();
        out.printf("Urgent pending orders requiring immediate processing (%d):%n", orders.size());
        for (Order order : orders) {
            double hours = Duration.between(clock.instant(), order.requiredBy()).toMinutes() / 60.0;
            out.printf("%n  Order: %s%n", order.id());
            out.printf("    Priority: %s, Shipping: %s%n", order.priority(), order.shippingMethod());
            out.printf(Locale.ROOT, "    Due: %s (%.1f hours)%n", order.requiredBy(), hours);
            out.printf("    Lines: %d%n", order.lines().size());
        }
    }

    private void printSpecialHandling(PrintStream out) {
        var placements = specialHandlingPlacements();
        out.printf("Products requiring special handling (%d):%n", placements.size());
        placements.forEach((product, locations) -> {
            out.printf("%n  SKU: %s - %s%n", product.sku(), product.name());
            out.printf("    Attributes:%s%s%s%n",
                    product.hazmat() ? " Hazmat" : "",
                    product.fragile() ? " Fragile" : "",
                    product.requiresRefrigeration() ? " Refrigerated" : "");
            out.printf("    Suitable locations: %d%n", locations.size());
            locations.stream()
                    .limit(LOCATION_SUGGESTIONS)
                    .forEach(l -> out.printf("      - %s (%s)%n", l.id(), l.address()));
        });
    }

    private void printExpiryReport(PrintStream out) {
        var report = expiryReport();
        out.printf("CRITICAL - Expired (%d):%n", report.expired().size());
        report.expired().forEach(p -> stockOf(p).ifPresent(i ->
                out.printf("  x %s - Qty: %d, Expired: %s%n", p.sku(), i.quantity(), p.expiresAt())));
        out.printf("%nHIGH - Expiring within %d days (%d):%n", HIGH_PRIORITY_EXPIRY_DAYS, report.expiringSoon().size());
        report.expiringSoon().forEach(p -> stockOf(p).ifPresent(i ->
                out.printf("  ! %s - Qty: %d, Days left: %d%n", p.sku(), i.quantity(), daysUntilExpiry(p))));
        out.printf("%nMEDIUM - Expiring within %d days (%d):%n", properties.expiringDays(), report.expiringLater().size());
        report.expiringLater().forEach(p -> stockOf(p).ifPresent(i ->
                out.printf("  * %s - Qty: %d, Days left: %d%n", p.sku(), i.quantity(), daysUntilExpiry(p))));
    }

    private void printBatches(PrintStream out) {
        var batches = orderBatches();
        int orderCount = batches.values().stream().mapToInt(List::size).sum();
        out.printf("Orders eligible for batching (%d):%n", orderCount);
        batches.forEach((clientId, orders) -> {
            out.printf("%n  Client: %s%n", clientId);
            out.printf("    Orders in batch: %d%n", orders.size());
            out.printf("    Total line items: %d%n", orders.stream().mapToInt(o -> o.lines().size()).sum());
            out.printf("    Order IDs: %s%n", orders.stream().map(Order::id).collect(Collectors.joining(", ")));
        });
    }

    private void printDeliveryIssues(PrintStream out) {
        var shipments = deliveryIssues();
        var premium = ClientSpecifications.isPremiumOrEnterprise();
        out.printf("Shipments with delivery issues (%d):%n", shipments.size());
        for (Shipment shipment : shipments) {
            var client = dataset.client(shipment.clientId());
            boolean highPriority = client.filter(premium::isSatisfiedBy).isPresent();
            out.printf("%n  Shipment: %s [Priority: %s]%n", shipment.id(), highPriority ? "HIGH" : "NORMAL");
            out.printf("    Client: %s (%s)%n",
                    client.map(Client::name).orElse(shipment.clientId()),
                    client.map(c -> c.tier().name()).orElse("unknown tier"));
            out.printf("    Status: %s, Carrier: %s, Tracking: %s%n",
                    shipment.status(), shipment.carrier(), shipment.trackingNumber());
            out.printf("    Shipped: %s%n", shipment.shippedAt());
        }
    }

    private void printCycleCounts(PrintStream out) {
        var counts = cycleCountPriorities();
        out.printf("Top %d priority cycle counts (%d found):%n", CYCLE_COUNT_LIMIT, counts.size());
        int rank = 1;
        for (CycleCount count : counts) {
            var inventory = count.inventory();
            out.printf("%n  %d. SKU: %s at %s%n", rank++, inventory.sku(), inventory.locationId());
            out.printf("     Client: %s%n", count.client().map(c -> c.name() + " (" + c.tier() + ")").orElse(inventory.clientId()));
            out.printf(Locale.ROOT, "     Value: $%.2f, Qty: %d, Days since count: %d%n",
                    count.product().map(Product::unitCost).orElse(0.0), inventory.quantity(), count.daysSinceCount());
        }
    }

    private void printCompliance(PrintStream out) {
        var reviews = internationalCompliance();
        out.printf("International orders (%d):%n", reviews.size());
        for (ComplianceReview review : reviews) {
            var order = review.order();
            out.printf("%n  Order: %s to %s (%s)%n", order.id(), order.destinationCountry(), order.status());
            if (!review.hasIssues()) {
                out.println("    No compliance issues");
                continue;
            }
            out.println("    COMPLIANCE ISSUES:");
            if (review.containsHazmat()) {
                out.println("      - Contains hazmat items (special documentation required)");
            }
            if (review.containsPerishable()) {
                out.println("      - Contains perishable items (expedited shipping required)");
            }
        }
    }
}
