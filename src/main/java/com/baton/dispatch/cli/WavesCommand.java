package com.baton.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;

/**
 * CLI command: baton waves &lt;epic-id&gt;
 */
@Command(name = "waves", mixinStandardHelpOptions = true, description = "Show wave progress of an epic")
@Component
public class WavesCommand extends ApiCommand {

    @Parameters(index = "0", description = "Epic ID")
    private String epicId;

    public WavesCommand(BatonApiClient client) {
        super(client);
    }

    @Override
    protected void call() throws IOException, InterruptedException {
        ConsoleOutput.printBanner();
        var response = client.get("/api/v1/epics/" + StatusCommand.strip(epicId) + "/waves");
        if (!check(response)) return;

        System.out.println();
        System.out.println("EPIC #" + response.body().path("epic_id").asText() + "  "
                + response.body().path("title").asText());
        var waves = response.body().path("waves");
        if (waves.isEmpty()) {
            ConsoleOutput.info("No wave-tagged work items");
            return;
        }
        for (var wave : waves) {
            ConsoleOutput.wave(wave);
        }
        String active = response.body().path("active_wave").asText("");
        if (active.isEmpty() || "null".equals(active)) {
            ConsoleOutput.success("All waves completed");
        } else {
            ConsoleOutput.info("Active wave: " + active);
        }
    }
}
