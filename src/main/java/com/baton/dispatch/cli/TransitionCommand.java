package com.baton.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.util.Map;

/**
 * CLI command: baton transition &lt;work-item-id&gt; --from dev_open --to dev_closed --actor &lt;name&gt;
 */
@Command(name = "transition", mixinStandardHelpOptions = true, description = "Request a phase transition")
@Component
public class TransitionCommand extends ApiCommand {

    @Parameters(index = "0", description = "Work item ID")
    private String workItemId;

    @Option(names = "--from", required = true, description = "Current phase")
    private String from;

    @Option(names = "--to", required = true, description = "Requested phase")
    private String to;

    @Option(names = {"--actor", "-a"}, required = true, description = "Initiating actor")
    private String actor;

    public TransitionCommand(BatonApiClient client) {
        super(client);
    }

    @Override
    protected void call() throws IOException, InterruptedException {
        var response = client.post("/api/v1/work-items/" + StatusCommand.strip(workItemId) + "/transitions",
                Map.of("from", from, "to", to, "actor", actor));
        if (!check(response)) return;
        ConsoleOutput.phase(response.body().path("from").asText(), response.body().path("to").asText());
        printViolations(response.body());
    }

    static void printViolations(JsonNode result) {
        JsonNode violations = result.path("violations");
        if (violations.isArray() && !violations.isEmpty()) {
            ConsoleOutput.warn("Recorded violations:");
            ConsoleOutput.violations(violations);
        }
    }
}
