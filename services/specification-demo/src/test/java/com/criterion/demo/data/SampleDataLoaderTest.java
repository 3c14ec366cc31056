package com.criterion.demo.data;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.criterion.demo.config.DemoConfig;
import com.criterion.demo.config.DemoProperties;
import com.criterion.warehouse.model.ClientTier;
import com.criterion.warehouse.model.LocationType;
import com.fasterxml.jackson.databind.JsonMappingException;
import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

@DisplayName("SampleDataLoader")
class SampleDataLoaderTest {

    private final SampleDataLoader loader =
            new SampleDataLoader(new DemoConfig().objectMapper(), new DefaultResourceLoader());

    @Nested
    @DisplayName("Bundled dataset")
    class BundledDataset {

        @Test
        @DisplayName("should load every section")
        void shouldLoadEverySection() {
            var dataset = loader.load(DemoProperties.DEFAULT_SAMPLE_DATA);

            assertThat(dataset.clients()).hasSize(4);
            assertThat(dataset.products()).hasSize(7);
            assertThat(dataset.inventory()).hasSize(7);
            assertThat(dataset.locations()).hasSize(5);
            assertThat(dataset.orders()).hasSize(5);
            assertThat(dataset.shipments()).hasSize(4);
        }

        @Test
        @DisplayName("should map enums, instants, nested records and missing optionals")
        void shouldMapFields() {
            var dataset = loader.load(DemoProperties.DEFAULT_SAMPLE_DATA);

            var tireRack = dataset.client("TR001").orElseThrow();
            assertThat(tireRack.tier()).isEqualTo(ClientTier.ENTERPRISE);
            assertThat(tireRack.contractStart()).isEqualTo(Instant.parse("2023-06-15T12:00:00Z"));

            var tire = dataset.product("TIRE-001").orElseThrow();
            assertThat(tire.dimensions().volume()).isEqualTo(28 * 9 * 28);
            assertThat(tire.expiresAt()).isNull();

            assertThat(dataset.orders().get(1).lines()).hasSize(2);
            assertThat(dataset.shipments().get(0).deliveredAt()).isNull();
        }

        @Test
        @DisplayName("lookups should return empty for unknown ids")
        void unknownIds() {
            var dataset = loader.load(DemoProperties.DEFAULT_SAMPLE_DATA);

            assertThat(dataset.client("NOPE")).isEmpty();
            assertThat(dataset.product("NOPE")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Partial dataset")
    class PartialDataset {

        @Test
        @DisplayName("should treat absent sections as empty")
        void absentSectionsAreEmpty() {
            var dataset = loader.load("classpath:sample-data/minimal.json");

            assertThat(dataset.locations()).singleElement()
                    .satisfies(l -> assertThat(l.type()).isEqualTo(LocationType.PICKING));
            assertThat(dataset.clients()).isEmpty();
            assertThat(dataset.orders()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("should report a missing resource")
        void missingResource() {
            assertThatThrownBy(() -> loader.load("classpath:sample-data/does-not-exist.json"))
                    .isInstanceOf(SampleDataException.class)
                    .hasMessage("Sample data not found: classpath:sample-data/does-not-exist.json");
        }

        @Test
        @DisplayName("should wrap parse errors")
        void malformedJson() {
            assertThatThrownBy(() -> loader.load("classpath:sample-data/malformed.json"))
                    .isInstanceOf(SampleDataException.class)
                    .hasMessageStartingWith("Failed to read sample data")
                    .hasCauseInstanceOf(JsonMappingException.class);
        }

        @Test
        @DisplayName("should list every validation error with its position")
        void invalidRecords() {
            assertThatThrownBy(() -> loader.load("classpath:sample-data/invalid-warehouse.json"))
                    .isInstanceOf(SampleDataException.class)
                    .hasMessageContaining("clients[0].id must not be null or blank")
                    .hasMessageContaining("clients[0].contractEnd must be after contractStart")
                    .hasMessageContaining("orders[0].lines must contain at least one order line");
        }
    }
}
