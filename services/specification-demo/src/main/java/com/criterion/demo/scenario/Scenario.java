package com.criterion.demo.scenario;

import java.io.PrintStream;
import java.util.function.Consumer;

/**
 * A titled walkthrough that prints its results.
 *
 * @param title heading printed before the body
 * @param body writes the scenario's report
 */
public record Scenario(String title, Consumer<PrintStream> body) {

    public Scenario {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title must not be null or blank");
        }
        if (body == null) {
            throw new IllegalArgumentException("body must not be null");
        }
    }

    public void run(PrintStream out) {
        out.println("=== " + title + " ===");
        out.println();
        body.accept(out);
        out.println();
    }
}
