package com.forgeloop.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command. Routes to subcommands: run, schedule.
 */
@Command(
        name = "forgeloop",
        mixinStandardHelpOptions = true,
        version = "Forgeloop 0.1.0",
        description = "Orchestration kernel that dispatches work-graph issues to isolated workcells",
        subcommands = {
                RunCommand.class,
                ScheduleCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ForgeloopCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
