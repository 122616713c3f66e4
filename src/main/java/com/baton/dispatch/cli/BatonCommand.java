package com.baton.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Baton.
 */
@Command(
        name = "baton",
        mixinStandardHelpOptions = true,
        version = "Baton 0.1.0",
        description = "Coordinates claims, phases, scopes and waves of multi-agent work",
        subcommands = {
                StatusCommand.class,
                WavesCommand.class,
                ClaimCommand.class,
                TransitionCommand.class,
                ScopeCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class BatonCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
