package io.github.manjago.pseudomem.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Pseudomem CLI - pseudocode interpreter with a visible memory model.
 *
 * Usage:
 *   pseudomem run <file> [options]     - Run a program
 *   pseudomem debug <file> [options]   - Step through a program, printing a frame per statement
 *   pseudomem check <file>             - Parse only
 *   pseudomem trace <archive>          - Inspect a saved run
 *   pseudomem info                     - Show version and config
 */
@Command(
    name = "pseudomem",
    description = "Pseudocode interpreter with simulated memory and operation tracing",
    mixinStandardHelpOptions = true,
    version = "Pseudomem 1.0.0",
    subcommands = {
        RunCommand.class,
        DebugCommand.class,
        CheckCommand.class,
        TraceCommand.class,
        InfoCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class PseudomemCli implements Runnable {

    @Override
    public void run() {
        // If no subcommand, show help
        CommandLine.usage(this, System.out);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new PseudomemCli())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
