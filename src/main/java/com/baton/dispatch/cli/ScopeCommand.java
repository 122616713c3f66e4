package com.baton.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * CLI command: baton scope &lt;work-item-id&gt; --actor &lt;name&gt; --claim a,b [--exclude c]
 * <p>
 * Declares the write-once scope of a work item and reports any overlap with siblings.
 */
@Command(name = "scope", mixinStandardHelpOptions = true, description = "Declare the scope of a work item")
@Component
public class ScopeCommand extends ApiCommand {

    @Parameters(index = "0", description = "Work item ID")
    private String workItemId;

    @Option(names = {"--actor", "-a"}, required = true, description = "Declaring actor")
    private String actor;

    @Option(names = {"--claim", "-c"}, required = true, split = ",", description = "Resources claimed exclusively")
    private List<String> claimed = new ArrayList<>();

    @Option(names = {"--exclude", "-x"}, split = ",", description = "Resources explicitly left alone")
    private List<String> excluded = new ArrayList<>();

    public ScopeCommand(BatonApiClient client) {
        super(client);
    }

    @Override
    protected void call() throws IOException, InterruptedException {
        var response = client.post("/api/v1/work-items/" + StatusCommand.strip(workItemId) + "/scope",
                Map.of("actor", actor, "claimed", claimed, "excluded", excluded));
        if (!check(response)) return;
        ConsoleOutput.success("Scope declared on #" + response.body().path("work_item_id").asText());
        var conflicts = response.body().path("conflicts");
        for (var conflict : conflicts) {
            var resources = new ArrayList<String>();
            conflict.path("resources").forEach(r -> resources.add(r.asText()));
            ConsoleOutput.warn("Conflicts with #" + conflict.path("counterpart").asText() + " on "
                    + String.join(", ", resources));
        }
    }
}
