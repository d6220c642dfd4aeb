package io.github.manjago.pseudomem.cli;

import io.github.manjago.pseudomem.config.InterpreterConfig;
import io.github.manjago.pseudomem.lang.Tokenizer;
import picocli.CommandLine.Command;

import java.util.TreeSet;
import java.util.concurrent.Callable;

/**
 * Show information about Pseudomem.
 */
@Command(
    name = "info",
    description = "Show version and configuration info",
    mixinStandardHelpOptions = true
)
public class InfoCommand implements Callable<Integer> {

    @Override
    public Integer call() {
        System.out.println();
        System.out.println("╔═══════════════════════════════════════╗");
        System.out.println("║              PSEUDOMEM                ║");
        System.out.println("║   Pseudocode Interpreter + Memory     ║");
        System.out.println("║          Version 1.0.0                ║");
        System.out.println("╚═══════════════════════════════════════╝");
        System.out.println();

        System.out.println("Default Configuration:");
        System.out.println(InterpreterConfig.defaults());

        System.out.println("Reserved words (" + Tokenizer.KEYWORDS.size() + "):");
        System.out.println("  " + String.join(" ", new TreeSet<>(Tokenizer.KEYWORDS)));
        System.out.println();
        System.out.println("Built-ins: LENGTH SUBSTRING UCASE LCASE INT REAL STRING ROUND RANDOM EOF");

        return 0;
    }
}
