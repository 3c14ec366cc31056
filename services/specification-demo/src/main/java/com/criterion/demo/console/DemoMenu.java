package com.criterion.demo.console;

import com.criterion.demo.scenario.Scenario;
import com.criterion.demo.scenario.SimpleScenarios;
import com.criterion.demo.scenario.WarehouseScenarios;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Numbered console menu over the simple and warehouse scenarios.
 *
 * <p>Reads one choice per line. An unknown choice is reported and the menu is shown again; end of
 * input behaves like choosing exit.
 */
@Component
public class DemoMenu {

    private static final Logger log = LoggerFactory.getLogger(DemoMenu.class);

    static final String INVALID_CHOICE = "Invalid choice. Please try again.";
    static final String GOODBYE = "Thank you for exploring the specification toolkit!";

    private static final String RULE = "-".repeat(63);

    private final SimpleScenarios simpleScenarios;
    private final WarehouseScenarios warehouseScenarios;

    public DemoMenu(SimpleScenarios simpleScenarios, WarehouseScenarios warehouseScenarios) {
        this.simpleScenarios = simpleScenarios;
        this.warehouseScenarios = warehouseScenarios;
    }

    /** Runs the menu loop until the user exits or the input ends. */
    public void run(BufferedReader in, PrintStream out) throws IOException {
        while (true) {
            printMainMenu(out);
            String line = in.readLine();
            if (line == null) {
                log.debug("Input closed, leaving menu");
                out.println();
                out.println(GOODBYE);
                return;
            }
            String choice = line.trim();
            log.debug("Menu choice: '{}'", choice);
            switch (choice) {
                case "1" -> runAll(simpleScenarios.scenarios(), out);
                case "2" -> runAll(warehouseScenarios.scenarios(), out);
                case "3" -> pick("SIMPLE SCENARIOS", simpleScenarios.scenarios(), in, out);
                case "4" -> pick("WAREHOUSE SCENARIOS", warehouseScenarios.scenarios(), in, out);
                case "5" -> printExplanation(out);
                case "0" -> {
                    out.println(GOODBYE);
                    return;
                }
                default -> out.println(INVALID_CHOICE);
            }
            out.println();
        }
    }

    /** Runs every scenario in order. */
    public static void runAll(List<Scenario> scenarios, PrintStream out) {
        for (int i = 0; i < scenarios.size(); i++) {
            log.debug("Running scenario {}: {}", i + 1, scenarios.get(i).title());
            scenarios.get(i).run(out);
        }
    }

    private static void pick(String heading, List<Scenario> scenarios, BufferedReader in, PrintStream out)
            throws IOException {
        out.println(RULE);
        out.println("  " + heading);
        out.println(RULE);
        for (int i = 0; i < scenarios.size(); i++) {
            out.printf("  [%d] %s%n", i + 1, scenarios.get(i).title());
        }
        out.println("  [0] Back to main menu");
        out.println();
        out.print("Enter your choice: ");

        String line = in.readLine();
        if (line == null || line.trim().equals("0")) {
            return;
        }
        out.println();
        try {
            int index = Integer.parseInt(line.trim()) - 1;
            if (index >= 0 && index < scenarios.size()) {
                scenarios.get(index).run(out);
                return;
            }
        } catch (NumberFormatException e) {
            log.debug("Non-numeric scenario choice '{}'", line.trim());
        }
        out.println(INVALID_CHOICE);
    }

    private static void printMainMenu(PrintStream out) {
        out.println(RULE);
        out.println("  MAIN MENU");
        out.println(RULE);
        out.println("  [1] Run all simple scenarios");
        out.println("  [2] Run all warehouse scenarios");
        out.println("  [3] Run a specific simple scenario");
        out.println("  [4] Run a specific warehouse scenario");
        out.println("  [5] Specification pattern explanation");
        out.println("  [0] Exit");
        out.println(RULE);
        out.print("Enter your choice: ");
    }

    private static void printExplanation(PrintStream out) {
        out.println(RULE);
        out.println("  THE SPECIFICATION PATTERN");
        out.println(RULE);
        out.println("A specification wraps one business rule as an object that answers");
        out.println("whether a candidate satisfies it. Rules combine with boolean logic:");
        out.println();
        out.println("  Specification<T>");
        out.println("    isSatisfiedBy(T candidate) -> boolean");
        out.println("    and(other), or(other), not()");
        out.println("    andNot(other), orNot(other)");
        out.println();
        out.println("Example:");
        out.println("  Specification<User> eligible = isAdult().and(isActiveUser());");
        out.println("  List<User> result = SpecificationFilters.toList(users, eligible);");
        out.println();
        out.println("Composed rules are immutable and can be shared, reused and tested");
        out.println("one rule at a time. Typical uses are filtering collections,");
        out.println("validating objects and expressing authorization rules.");
    }
}
