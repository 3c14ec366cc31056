package com.criterion.demo.data;

import com.criterion.specification.collection.SpecificationFilters;
import com.criterion.warehouse.model.Client;
import com.criterion.warehouse.model.Inventory;
import com.criterion.warehouse.model.Location;
import com.criterion.warehouse.model.Order;
import com.criterion.warehouse.model.Product;
import com.criterion.warehouse.model.Shipment;
import java.util.List;
import java.util.Optional;

/**
 * The warehouse records the demo scenarios run against. Absent sections become empty lists.
 */
public record WarehouseDataset(
        List<Client> clients,
        List<Product> products,
        List<Inventory> inventory,
        List<Location> locations,
        List<Order> orders,
        List<Shipment> shipments) {

    public WarehouseDataset {
        clients = copy(clients);
        products = copy(products);
        inventory = copy(inventory);
        locations = copy(locations);
        orders = copy(orders);
        shipments = copy(shipments);
    }

    /**
     * Looks up a client by id.
     *
     * @throws com.criterion.specification.collection.AmbiguousMatchException if the id is not unique
     */
    public Optional<Client> client(String id) {
        return SpecificationFilters.singleOrDefault(clients, c -> c.id().equals(id));
    }

    /**
     * Looks up a product by SKU.
     *
     * @throws com.criterion.specification.collection.AmbiguousMatchException if the SKU is not unique
     */
    public Optional<Product> product(String sku) {
        return SpecificationFilters.singleOrDefault(products, p -> p.sku().equals(sku));
    }

    private static <T> List<T> copy(List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }
}
