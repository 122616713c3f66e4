package com.baton.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;

/**
 * CLI command: baton status &lt;work-item-id&gt;
 * <p>
 * Shows phase, labels, scope, violations and checkpoint health of one work item.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show work item status")
@Component
public class StatusCommand extends ApiCommand {

    @Parameters(index = "0", description = "Work item ID")
    private String workItemId;

    public StatusCommand(BatonApiClient client) {
        super(client);
    }

    @Override
    protected void call() throws IOException, InterruptedException {
        ConsoleOutput.printBanner();

        var response = client.get("/api/v1/work-items/" + strip(workItemId));
        if (!check(response)) return;
        JsonNode item = response.body();

        System.out.println();
        System.out.println("WORK ITEM #" + item.path("id").asText() + "  " + item.path("title").asText());
        ConsoleOutput.info("Phase: " + item.path("phase").asText()
                + " (" + item.path("status_label").asText() + ")");
        if (!item.path("open_thread").isNull() && !item.path("open_thread").isMissingNode()) {
            ConsoleOutput.info("Open thread: " + item.path("open_thread").asText());
        }
        ConsoleOutput.info("Assignee: " + text(item.path("assignee")));
        if (!item.path("epic_id").isNull()) {
            ConsoleOutput.info("Epic: #" + item.path("epic_id").asText() + ", wave " + text(item.path("wave")));
        }
        ConsoleOutput.info("Labels: " + join(item.path("labels")));
        ConsoleOutput.info("Scope: claimed " + join(item.path("claimed")) + ", excluded " + join(item.path("excluded")));

        var violations = client.get("/api/v1/work-items/" + strip(workItemId) + "/violations");
        if (violations.isSuccess() && violations.body().size() > 0) {
            System.out.println();
            ConsoleOutput.warn("Violations:");
            ConsoleOutput.violations(violations.body());
        }

        var checkpoint = client.get("/api/v1/work-items/" + strip(workItemId) + "/checkpoint");
        if (checkpoint.isSuccess()) {
            System.out.println();
            if (checkpoint.body().path("valid").asBoolean()) {
                ConsoleOutput.success("Checkpoint: complete");
            } else {
                ConsoleOutput.error("Checkpoint: " + checkpoint.body().path("reason").asText());
            }
        }
    }

    static String strip(String id) {
        return id.startsWith("#") ? id.substring(1) : id;
    }

    private static String text(JsonNode node) {
        return node.isNull() || node.isMissingNode() ? "-" : node.asText();
    }

    private static String join(JsonNode array) {
        if (!array.isArray() || array.isEmpty()) return "none";
        var sb = new StringBuilder();
        for (JsonNode value : array) {
            if (sb.length() > 0) sb.append(", ");
            sb.append(value.asText());
        }
        return sb.toString();
    }
}
