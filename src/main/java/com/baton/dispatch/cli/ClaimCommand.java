package com.baton.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.util.Map;

/**
 * CLI command: baton claim &lt;work-item-id&gt; --actor &lt;name&gt;
 */
@Command(name = "claim", mixinStandardHelpOptions = true, description = "Claim a ready work item")
@Component
public class ClaimCommand extends ApiCommand {

    @Parameters(index = "0", description = "Work item ID")
    private String workItemId;

    @Option(names = {"--actor", "-a"}, required = true, description = "Claiming actor")
    private String actor;

    public ClaimCommand(BatonApiClient client) {
        super(client);
    }

    @Override
    protected void call() throws IOException, InterruptedException {
        var response = client.post("/api/v1/work-items/" + StatusCommand.strip(workItemId) + "/claim",
                Map.of("actor", actor));
        if (!check(response)) return;
        ConsoleOutput.success("#" + response.body().path("work_item_id").asText() + " claimed by " + actor);
        TransitionCommand.printViolations(response.body());
    }
}
