package com.strata.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Strata.
 * Routes to subcommands: run, resume, convert, cleanup.
 */
@Command(
        name = "strata",
        mixinStandardHelpOptions = true,
        version = "Strata 0.1.0",
        description = "Layered DAG workflow engine with approval gates and checkpointed resumption",
        subcommands = {
                RunCommand.class,
                ResumeCommand.class,
                ConvertCommand.class,
                CleanupCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class StrataCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
