package io.github.manjago.pseudomem.cli;

import io.github.manjago.pseudomem.core.Allocation;
import io.github.manjago.pseudomem.persistence.TraceArchive;
import io.github.manjago.pseudomem.persistence.TraceStore;
import io.github.manjago.pseudomem.trace.TraceEntry;
import io.github.manjago.pseudomem.trace.TraceLog;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: trace
 *
 * Inspects a run archive written by {@code pseudomem run --archive}.
 *
 * Usage:
 *   pseudomem trace run.mv                  # Summary and statistics
 *   pseudomem trace run.mv --report         # Full trace report
 *   pseudomem trace run.mv --variable x     # Entries naming x
 *   pseudomem trace run.mv --address 0x400  # Entries touching an address
 *   pseudomem trace run.mv --lines 3:7      # Entries from source lines 3..7
 */
@Command(
    name = "trace",
    description = "Inspect a saved run archive",
    mixinStandardHelpOptions = true
)
public class TraceCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Run archive (.mv)")
    private Path archiveFile;

    @Option(names = {"--report"}, description = "Print the full trace report")
    private boolean report;

    @Option(names = {"--variable"}, description = "Only entries for this variable")
    private String variable;

    @Option(names = {"--address"}, description = "Only entries touching this address (decimal or 0x hex)")
    private String address;

    @Option(names = {"--steps"}, description = "Only steps in from:to (inclusive)")
    private String steps;

    @Option(names = {"--lines"}, description = "Only source lines in from:to (inclusive)")
    private String lines;

    @Option(names = {"--output"}, description = "Print the program's output lines")
    private boolean showOutput;

    @Option(names = {"--source"}, description = "Print the program source")
    private boolean showSource;

    @Override
    public Integer call() {
        if (!Files.exists(archiveFile) || !TraceStore.isValidArchive(archiveFile)) {
            System.err.println("❌ Not a run archive: " + archiveFile);
            return CliSupport.EXIT_IO;
        }

        TraceArchive archive;
        try {
            archive = TraceStore.load(archiveFile);
        } catch (IOException e) {
            System.err.println("❌ Cannot load " + archiveFile + ": " + e.getMessage());
            return CliSupport.EXIT_IO;
        }

        System.out.println("📂 " + TraceStore.getInfo(archiveFile));
        if (archive.failed()) {
            System.out.println("❌ " + archive.failure());
        }
        System.out.println();

        if (showSource) {
            System.out.println("=== Source ===");
            String[] sourceLines = archive.source().split("\n", -1);
            for (int i = 0; i < sourceLines.length; i++) {
                System.out.printf("%4d  %s%n", i + 1, sourceLines[i]);
            }
            System.out.println();
        }

        if (showOutput) {
            System.out.println("=== Output ===");
            archive.output().forEach(System.out::println);
            System.out.println();
        }

        TraceLog trace = archive.trace();
        if (report) {
            System.out.print(trace.generateReport());
            return CliSupport.EXIT_OK;
        }

        List<TraceEntry> selected = select(trace);
        if (selected != null) {
            System.out.println("=== Entries (" + selected.size() + ") ===");
            selected.forEach(System.out::println);
            return CliSupport.EXIT_OK;
        }

        System.out.println(trace.getStatistics());
        System.out.println();
        System.out.println(archive.memory());
        System.out.println("Live blocks (" + archive.allocations().size() + "):");
        for (Allocation allocation : archive.allocations()) {
            System.out.println("  " + allocation);
        }
        return CliSupport.EXIT_OK;
    }

    /**
     * Entries matching the filter options, or null if none was given.
     */
    private List<TraceEntry> select(TraceLog trace) {
        if (variable != null) {
            return trace.getVariableTrace(variable);
        }
        if (address != null) {
            return trace.getAddressTrace(Integer.decode(address));
        }
        if (steps != null) {
            int[] range = CliSupport.parsePair(steps, "from:to");
            return trace.getOperationsByStepRange(range[0], range[1]);
        }
        if (lines != null) {
            int[] range = CliSupport.parsePair(lines, "from:to");
            return trace.getOperationsByLineRange(range[0], range[1]);
        }
        return null;
    }
}
