package com.baton.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.io.IOException;
import java.util.Iterator;
import java.util.Map;

/**
 * CLI command: baton health
 * <p>
 * Queries the server's health endpoint and displays each component.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check system health")
@Component
public class HealthCommand extends ApiCommand {

    public HealthCommand(BatonApiClient client) {
        super(client);
    }

    @Override
    protected void call() throws IOException, InterruptedException {
        ConsoleOutput.printBanner();

        var response = client.get("/api/v1/health");
        boolean allUp = true;
        Iterator<Map.Entry<String, com.fasterxml.jackson.databind.JsonNode>> components =
                response.body().path("components").fields();
        while (components.hasNext()) {
            var component = components.next();
            String label = component.getKey() + ": " + component.getValue().path("detail").asText();
            switch (component.getValue().path("status").asText()) {
                case "UP" -> ConsoleOutput.success(label);
                case "DEGRADED" -> {
                    ConsoleOutput.info(label);
                    allUp = false;
                }
                default -> {
                    ConsoleOutput.error(label);
                    allUp = false;
                }
            }
        }

        System.out.println("──────────────────────────────────");
        if (allUp && response.isSuccess()) {
            ConsoleOutput.success("Overall: all systems operational");
        } else {
            ConsoleOutput.error("Overall: one or more components degraded or down");
        }
    }
}
