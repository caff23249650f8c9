package com.quillmind.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Quillmind.
 * Routes to subcommands: validate, resolve, standards, strategies.
 */
@Command(
        name = "quillmind",
        mixinStandardHelpOptions = true,
        version = "Quillmind 0.1.0",
        description = "Quality validation and conflict resolution for generated writing",
        subcommands = {
                ValidateCommand.class,
                ResolveCommand.class,
                StandardsCommand.class,
                StrategiesCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class QuillmindCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
