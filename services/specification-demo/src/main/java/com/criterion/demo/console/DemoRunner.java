package com.criterion.demo.console;

import com.criterion.demo.config.DemoProperties;
import com.criterion.demo.scenario.SimpleScenarios;
import com.criterion.demo.scenario.WarehouseScenarios;
import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/** Starts the demo once the context is ready: the menu when interactive, otherwise every scenario. */
@Component
public class DemoRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(DemoRunner.class);

    private final DemoProperties properties;
    private final DemoMenu menu;
    private final SimpleScenarios simpleScenarios;
    private final WarehouseScenarios warehouseScenarios;

    public DemoRunner(
            DemoProperties properties,
            DemoMenu menu,
            SimpleScenarios simpleScenarios,
            WarehouseScenarios warehouseScenarios) {
        this.properties = properties;
        this.menu = menu;
        this.simpleScenarios = simpleScenarios;
        this.warehouseScenarios = warehouseScenarios;
    }

    @Override
    public void run(String... args) throws Exception {
        if (properties.interactive()) {
            log.info("Starting interactive menu");
            // stdin stays open for the JVM's lifetime
            var in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            menu.run(in, System.out);
            return;
        }
        log.info("Running all scenarios (set criterion.demo.interactive=true for the menu)");
        DemoMenu.runAll(simpleScenarios.scenarios(), System.out);
        DemoMenu.runAll(warehouseScenarios.scenarios(), System.out);
    }
}
