package com.criterion.demo.console;

import static org.assertj.core.api.Assertions.assertThat;

import com.criterion.demo.config.DemoConfig;
import com.criterion.demo.config.DemoProperties;
import com.criterion.demo.data.SampleDataLoader;
import com.criterion.demo.scenario.SimpleScenarios;
import com.criterion.demo.scenario.WarehouseScenarios;
import com.criterion.warehouse.testing.TestWarehouseFactory;
import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

@DisplayName("DemoMenu")
class DemoMenuTest {

    private DemoMenu menu;

    @BeforeEach
    void setUp() {
        var loader = new SampleDataLoader(new DemoConfig().objectMapper(), new DefaultResourceLoader());
        var properties = new DemoProperties(true, TestWarehouseFactory.REFERENCE_TIME, null, null, 0, 0);
        var warehouse = new WarehouseScenarios(
                loader.load(properties.sampleData()), TestWarehouseFactory.fixedClock(), properties);
        menu = new DemoMenu(new SimpleScenarios(), warehouse);
    }

    private String run(String input) throws IOException {
        var buffer = new ByteArrayOutputStream();
        menu.run(new BufferedReader(new StringReader(input)), new PrintStream(buffer, true, StandardCharsets.UTF_8));
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("should exit on 0")
    void exitsOnZero() throws IOException {
        var output = run("0\n");

        assertThat(output).contains("MAIN MENU").endsWith(DemoMenu.GOODBYE + System.lineSeparator());
    }

    @Test
    @DisplayName("should exit when input ends")
    void exitsOnEndOfInput() throws IOException {
        assertThat(run("")).contains(DemoMenu.GOODBYE);
    }

    @Test
    @DisplayName("should report an invalid choice and show the menu again")
    void invalidChoice() throws IOException {
        var output = run("9\nabc\n0\n");

        assertThat(output.split("MAIN MENU", -1)).hasSize(4);
        assertThat(output).contains(DemoMenu.INVALID_CHOICE);
    }

    @Test
    @DisplayName("should run all simple scenarios on 1")
    void runsAllSimple() throws IOException {
        var output = run("1\n0\n");

        assertThat(output).contains("=== User Validation ===", "=== NOT Operator ===");
        assertThat(output).doesNotContain("=== Order Batching ===");
    }

    @Test
    @DisplayName("should run all warehouse scenarios on 2")
    void runsAllWarehouse() throws IOException {
        var output = run("2\n0\n");

        assertThat(output).contains("=== Low Stock Alert for Premium Clients ===",
                "=== International Shipment Compliance ===");
    }

    @Test
    @DisplayName("should run one picked scenario from each submenu")
    void picksScenarios() throws IOException {
        var output = run("3\n4\n4\n5\n0\n");

        assertThat(output).contains("=== Password Strength Validation ===", "=== Order Batching ===");
        assertThat(output).doesNotContain("=== User Validation ===");
    }

    @Test
    @DisplayName("should return from a submenu on 0 or an invalid pick")
    void submenuBack() throws IOException {
        var output = run("3\n0\n4\n42\n0\n");

        assertThat(output).contains("[0] Back to main menu", DemoMenu.INVALID_CHOICE);
        assertThat(output).doesNotContain("===");
    }

    @Test
    @DisplayName("should explain the pattern on 5")
    void explanation() throws IOException {
        assertThat(run("5\n0\n")).contains("THE SPECIFICATION PATTERN", "andNot(other), orNot(other)");
    }
}
