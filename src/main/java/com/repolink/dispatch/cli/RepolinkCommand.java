package com.repolink.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Repolink.
 * Routes to subcommands: serve, health, commit.
 */
@Command(
        name = "repolink",
        mixinStandardHelpOptions = true,
        version = "Repolink 0.1.0",
        description = "File context cache and atomic multi-file GitHub commits",
        subcommands = {
                ServeCommand.class,
                HealthCommand.class,
                CommitCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class RepolinkCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
