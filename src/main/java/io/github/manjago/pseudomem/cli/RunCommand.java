package io.github.manjago.pseudomem.cli;

import io.github.manjago.pseudomem.config.InterpreterConfig;
import io.github.manjago.pseudomem.core.MemoryFaultException;
import io.github.manjago.pseudomem.core.ProgramException;
import io.github.manjago.pseudomem.exec.Evaluator;
import io.github.manjago.pseudomem.exec.ExecutionOptions;
import io.github.manjago.pseudomem.exec.ExecutionSession;
import io.github.manjago.pseudomem.exec.ExecutionStats;
import io.github.manjago.pseudomem.exec.ProgramRun;
import io.github.manjago.pseudomem.lang.Parser;
import io.github.manjago.pseudomem.lang.Program;
import io.github.manjago.pseudomem.lang.SyntaxException;
import io.github.manjago.pseudomem.persistence.TraceArchive;
import io.github.manjago.pseudomem.persistence.TraceStore;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Run a program.
 *
 * Examples:
 *   pseudomem run sort.pseudo                      # Run, INPUT from stdin
 *   pseudomem run io.pseudo --write-dir out        # Save WRITE/APPEND files to out/
 *   pseudomem run ptr.pseudo --dump 0x400:64       # Hex dump after the run
 *   pseudomem run ptr.pseudo --archive ptr.mv      # Save output and trace for 'pseudomem trace'
 */
@Command(
    name = "run",
    description = "Run a pseudocode program",
    mixinStandardHelpOptions = true
)
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Program file")
    private Path programFile;

    @Option(names = {"-f", "--config"}, description = "Configuration file (HOCON)")
    private Path configFile;

    @Option(names = {"--seed"}, description = "Seed for RANDOM() (0 = clock)")
    private Long seed;

    @Option(names = {"--max-iterations"}, description = "Iteration budget")
    private Integer maxIterations;

    @Option(names = {"--no-echo-writes"}, description = "Don't echo WRITEFILE lines to the output")
    private boolean noEchoWrites;

    @Option(names = {"--write-dir"}, description = "Directory to save files the program writes")
    private Path writeDir;

    @Option(names = {"--dump"}, description = "Hex dump after the run, as start:length")
    private String dumpRange;

    @Option(names = {"--report"}, description = "Print the memory trace report after the run")
    private boolean report;

    @Option(names = {"--archive"}, description = "Save the run to an archive file (.mv)")
    private Path archiveFile;

    @Option(names = {"-q", "--quiet"}, description = "Quiet mode (program output only)")
    private boolean quiet;

    @Override
    public Integer call() {
        String source;
        Program program;
        try {
            source = CliSupport.readSource(programFile);
            program = Parser.parse(source);
        } catch (IOException e) {
            System.err.println("❌ Cannot read " + programFile + ": " + e.getMessage());
            return CliSupport.EXIT_IO;
        } catch (SyntaxException e) {
            System.err.println("❌ Syntax error: " + e.getMessage());
            return CliSupport.EXIT_SYNTAX;
        }

        InterpreterConfig config = CliSupport.buildConfig(configFile, seed, maxIterations);
        if (!quiet) {
            printBanner();
        }

        Evaluator evaluator = new Evaluator(config);
        BufferedReader stdin = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        Path baseDir = programFile.toAbsolutePath().getParent();
        ExecutionOptions options = ExecutionOptions.builder(config)
                .debugMode(false)
                .echoFileWrites(config.echoFileWrites() && !noEchoWrites)
                .inputHandler(CliSupport.lineInput(stdin, System.err, !quiet))
                .fileReadHandler(CliSupport.localFiles(baseDir))
                .build();

        ProgramRun run = evaluator.executeProgram(program, options);
        ExecutionSession session = run.getSession();
        int exitCode = CliSupport.EXIT_OK;
        try {
            while (run.hasNext()) {
                System.out.println(run.next());
            }
        } catch (ProgramException e) {
            System.err.println((e instanceof MemoryFaultException ? "💥 " : "❌ ") + e.getMessage());
            System.err.println("   Call stack: " + session.getCallStack());
            exitCode = CliSupport.EXIT_RUNTIME;
        }

        try {
            afterRun(source, session, evaluator);
        } catch (IOException e) {
            System.err.println("❌ " + e.getMessage());
            return CliSupport.EXIT_IO;
        }
        return exitCode;
    }

    private void afterRun(String source, ExecutionSession session, Evaluator evaluator) throws IOException {
        if (writeDir != null) {
            CliSupport.writeFiles(session.getFiles().getWrittenFiles(), writeDir, System.err);
        }
        if (dumpRange != null) {
            int[] range = CliSupport.parsePair(dumpRange, "start:length");
            System.out.println();
            System.out.print(evaluator.getMemory().generateHexDump(range[0], range[1]));
        }
        if (report) {
            System.out.println();
            System.out.print(evaluator.getTrace().generateReport());
        }
        if (archiveFile != null) {
            TraceStore.save(TraceArchive.of(source, session), archiveFile);
            if (!quiet) {
                System.err.println("📦 Archived to " + archiveFile);
            }
        }
        if (!quiet) {
            printFinalReport(session.getStats());
        }
    }

    private void printBanner() {
        System.err.println();
        System.err.println("╔═══════════════════════════════════════╗");
        System.err.println("║          PSEUDOMEM Interpreter        ║");
        System.err.println("╚═══════════════════════════════════════╝");
        System.err.println("▶️  Running " + programFile);
        System.err.println();
    }

    private void printFinalReport(ExecutionStats stats) {
        System.err.println();
        System.err.println("═══════════════════════════════════════");
        System.err.printf("⏱️  Time: %s  |  Iterations: %,d%n",
                CliSupport.formatDuration(stats.elapsedMillis()), stats.iterations());
        System.err.printf("📞 Calls: %,d (max depth %d)  |  Trace entries: %,d%n",
                stats.calls(), stats.maxCallDepth(), stats.traceEntries());
        System.err.printf("💾 Memory: %,d slots in %d blocks (%.1f%% used), watermark 0x%04X%n",
                stats.memory().allocated(), stats.memory().blocks(), stats.memory().usagePercent(),
                stats.memory().nextFreeAddress());
        System.err.println("═══════════════════════════════════════");
    }
}
