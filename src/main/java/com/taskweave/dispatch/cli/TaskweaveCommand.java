package com.taskweave.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Taskweave.
 * Routes to subcommands: digest, profiles.
 */
@Command(
        name = "taskweave",
        mixinStandardHelpOptions = true,
        version = "Taskweave 0.1.0",
        description = "Decomposes jobs into sub-tasks and runs them in bounded waves against an LLM",
        subcommands = {
                DigestCommand.class,
                ProfilesCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class TaskweaveCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
