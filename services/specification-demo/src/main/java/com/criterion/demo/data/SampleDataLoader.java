package com.criterion.demo.data;

import com.criterion.warehouse.model.ValidationResult;
import com.criterion.warehouse.model.WarehouseValidator;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

/**
 * Reads a {@link WarehouseDataset} from JSON and validates every record in it.
 *
 * <p>Records are validated with {@link WarehouseValidator}; all problems across the file are
 * collected and reported together in one {@link SampleDataException}.
 */
public class SampleDataLoader {

    private static final Logger log = LoggerFactory.getLogger(SampleDataLoader.class);

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;

    public SampleDataLoader(ObjectMapper objectMapper, ResourceLoader resourceLoader) {
        this.objectMapper = objectMapper;
        this.resourceLoader = resourceLoader;
    }

    /**
     * Loads and validates the dataset at a Spring resource location such as
     * {@code classpath:sample-data/warehouse.json}.
     *
     * @throws SampleDataException if the resource is missing, malformed or holds invalid records
     */
    public WarehouseDataset load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new SampleDataException("Sample data not found: " + location);
        }
        WarehouseDataset dataset;
        try (InputStream in = resource.getInputStream()) {
            dataset = objectMapper.readValue(in, WarehouseDataset.class);
        } catch (IOException e) {
            throw new SampleDataException("Failed to read sample data from " + location, e);
        }
        if (dataset == null) {
            throw new SampleDataException("Sample data is empty: " + location);
        }
        validate(dataset, location);
        log.info("Loaded sample data from {}: {} clients, {} products, {} inventory records, "
                        + "{} locations, {} orders, {} shipments",
                location,
                dataset.clients().size(),
                dataset.products().size(),
                dataset.inventory().size(),
                dataset.locations().size(),
                dataset.orders().size(),
                dataset.shipments().size());
        return dataset;
    }

    private static void validate(WarehouseDataset dataset, String location) {
        var errors = new ArrayList<String>();
        collect(errors, "clients", dataset.clients(), WarehouseValidator::validate);
        collect(errors, "products", dataset.products(), WarehouseValidator::validate);
        collect(errors, "inventory", dataset.inventory(), WarehouseValidator::validate);
        collect(errors, "locations", dataset.locations(), WarehouseValidator::validate);
        collect(errors, "orders", dataset.orders(), WarehouseValidator::validate);
        collect(errors, "shipments", dataset.shipments(), WarehouseValidator::validate);
        if (!errors.isEmpty()) {
            throw new SampleDataException(
                    "Invalid sample data in " + location + ": " + String.join("; ", errors));
        }
    }

    private static <T> void collect(
            List<String> errors, String section, List<T> records, Function<T, ValidationResult> validator) {
        for (int i = 0; i < records.size(); i++) {
            for (String error : validator.apply(records.get(i)).errors()) {
                errors.add(section + "[" + i + "]." + error);
            }
        }
    }
}
