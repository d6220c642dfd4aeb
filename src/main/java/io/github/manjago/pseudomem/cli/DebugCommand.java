package io.github.manjago.pseudomem.cli;

import io.github.manjago.pseudomem.config.InterpreterConfig;
import io.github.manjago.pseudomem.core.ProgramException;
import io.github.manjago.pseudomem.debug.StepFrame;
import io.github.manjago.pseudomem.debug.StepPrinter;
import io.github.manjago.pseudomem.debug.StepRecorder;
import io.github.manjago.pseudomem.exec.Evaluator;
import io.github.manjago.pseudomem.exec.ExecutionOptions;
import io.github.manjago.pseudomem.exec.InputHandler;
import io.github.manjago.pseudomem.exec.ProgramRun;
import io.github.manjago.pseudomem.lang.Parser;
import io.github.manjago.pseudomem.lang.Program;
import io.github.manjago.pseudomem.lang.SyntaxException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.BufferedReader;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: debug
 *
 * Runs a program in debug mode, recording a frame before every statement.
 *
 * Usage:
 *   pseudomem debug prog.pseudo                      # Print every frame
 *   pseudomem debug prog.pseudo --frames 20          # Record only the first 20 steps
 *   pseudomem debug prog.pseudo --from 5 --to 9      # Show steps 5..9
 *   pseudomem debug prog.pseudo -i 3 -i 7            # Answer INPUT with 3, then 7
 *   pseudomem debug prog.pseudo --summary -o out.txt # Summary table to a file
 */
@Command(
    name = "debug",
    description = "Step through a program, printing state before each statement",
    mixinStandardHelpOptions = true
)
public class DebugCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Program file")
    private Path programFile;

    @Option(names = {"-f", "--config"}, description = "Configuration file (HOCON)")
    private Path configFile;

    @Option(names = {"-n", "--frames"}, description = "Maximum frames to record", defaultValue = "200")
    private int maxFrames;

    @Option(names = {"-i", "--input"}, description = "INPUT values, in order (default: stdin)")
    private List<String> inputs;

    @Option(names = {"--seed"}, description = "Seed for RANDOM() (0 = clock)")
    private Long seed;

    @Option(names = {"--from"}, description = "Show steps starting from this number")
    private Integer fromStep;

    @Option(names = {"--to"}, description = "Show steps up to this number (inclusive)")
    private Integer toStep;

    @Option(names = {"-o", "--output"}, description = "Output file (default: stdout)")
    private Path outputFile;

    @Option(names = {"--summary"}, description = "Show only summary table")
    private boolean summaryOnly;

    @Option(names = {"--compact"}, description = "Don't list slot values of memory blocks")
    private boolean compact;

    @Override
    public Integer call() {
        Program program;
        try {
            program = Parser.parse(CliSupport.readSource(programFile));
        } catch (IOException e) {
            System.err.println("❌ Cannot read " + programFile + ": " + e.getMessage());
            return CliSupport.EXIT_IO;
        } catch (SyntaxException e) {
            System.err.println("❌ Syntax error: " + e.getMessage());
            return CliSupport.EXIT_SYNTAX;
        }

        InterpreterConfig config = CliSupport.buildConfig(configFile, seed, null);
        Evaluator evaluator = new Evaluator(config);
        StepRecorder recorder = new StepRecorder(maxFrames, evaluator.getMemory(), evaluator.getTrace());
        evaluator.setListener(recorder);

        InputHandler input = inputs != null
                ? InputHandler.scripted(inputs.toArray(new String[0]))
                : CliSupport.lineInput(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                        System.err, false);
        ExecutionOptions options = ExecutionOptions.builder(config)
                .debugMode(true)
                .stepHandler(recorder)
                .inputHandler(input)
                .fileReadHandler(CliSupport.localFiles(programFile.toAbsolutePath().getParent()))
                .build();

        ProgramRun run = evaluator.executeProgram(program, options);
        ProgramException failure = null;
        try {
            run.forEachRemaining(line -> { });
        } catch (ProgramException e) {
            failure = e;
        }

        PrintStream out = System.out;
        try {
            if (outputFile != null) {
                out = new PrintStream(new FileOutputStream(outputFile.toFile()), true, StandardCharsets.UTF_8);
            }
            printReport(out, recorder, run, failure);
        } catch (IOException e) {
            System.err.println("❌ Cannot write " + outputFile + ": " + e.getMessage());
            return CliSupport.EXIT_IO;
        } finally {
            if (out != System.out) {
                out.close();
            }
        }

        return failure != null ? CliSupport.EXIT_RUNTIME : CliSupport.EXIT_OK;
    }

    private void printReport(PrintStream out, StepRecorder recorder, ProgramRun run, ProgramException failure) {
        printHeader(out, recorder);
        List<StepFrame> frames = selectFrames(recorder.getFrames());
        StepPrinter printer = new StepPrinter(out).compactMode(compact);
        if (summaryOnly) {
            printer.printSummary(frames);
        } else {
            printer.printAll(frames);
        }

        out.println();
        out.println("Output:");
        run.getSession().getOutputLog().forEach(line -> out.println("  " + line));
        if (failure != null) {
            out.println();
            out.println("❌ " + failure.getMessage());
            out.println("   Call stack: " + run.getSession().getCallStack());
        }
    }

    private List<StepFrame> selectFrames(List<StepFrame> frames) {
        int from = fromStep != null ? fromStep : 0;
        int to = toStep != null ? toStep : Integer.MAX_VALUE;
        return frames.stream()
                .filter(f -> f.step() >= from && f.step() <= to)
                .toList();
    }

    private void printHeader(PrintStream out, StepRecorder recorder) {
        out.println("🔍 Debug: " + programFile);
        out.printf("   Recorded %d frames%s%n", recorder.getFrameCount(),
                recorder.isComplete() ? " (limit reached)" : "");
        out.println();
    }
}
