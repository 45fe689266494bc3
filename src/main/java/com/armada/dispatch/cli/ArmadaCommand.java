package com.armada.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for armada.
 * Routes to subcommands: epic, project, status.
 */
@Command(
        name = "armada",
        mixinStandardHelpOptions = true,
        version = "armada 0.1.0",
        description = "Wave-based orchestrator for agent work across issues, epics and projects",
        subcommands = {
                EpicCommand.class,
                ProjectCommand.class,
                StatusCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ArmadaCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // no subcommand given
        spec.commandLine().usage(System.out);
    }
}
