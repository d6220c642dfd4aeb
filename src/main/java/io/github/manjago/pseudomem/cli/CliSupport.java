package io.github.manjago.pseudomem.cli;

import io.github.manjago.pseudomem.config.InterpreterConfig;
import io.github.manjago.pseudomem.exec.FileReadHandler;
import io.github.manjago.pseudomem.exec.InputHandler;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Helpers shared by the commands.
 */
final class CliSupport {

    static final int EXIT_OK = 0;
    static final int EXIT_IO = 1;
    static final int EXIT_SYNTAX = 2;
    static final int EXIT_RUNTIME = 3;

    private CliSupport() {
    }

    /**
     * Configuration from an optional file plus command-line overrides.
     */
    static InterpreterConfig buildConfig(Path configFile, Long seed, Integer maxIterations) {
        InterpreterConfig base = configFile != null
                ? InterpreterConfig.fromFile(configFile)
                : InterpreterConfig.defaults();
        InterpreterConfig.Builder builder = base.toBuilder();

        // Override from CLI options
        if (seed != null) builder.randomSeed(seed);
        if (maxIterations != null) builder.maxIterations(maxIterations);

        return builder.build();
    }

    static String readSource(Path file) throws IOException {
        return Files.readString(file, StandardCharsets.UTF_8);
    }

    /**
     * INPUT answered line by line from a reader. End of input fails the request.
     */
    static InputHandler lineInput(BufferedReader reader, PrintStream prompt, boolean showPrompt) {
        return (name, type) -> {
            if (showPrompt) {
                prompt.printf("? %s (%s): ", name, type);
                prompt.flush();
            }
            try {
                String line = reader.readLine();
                if (line == null) {
                    return CompletableFuture.failedFuture(
                            new IllegalStateException("end of input while reading '" + name + "'"));
                }
                return CompletableFuture.completedFuture(line);
            } catch (IOException e) {
                return CompletableFuture.failedFuture(e);
            }
        };
    }

    /**
     * OPENFILE ... FOR READ answered from local files relative to {@code baseDir}.
     */
    static FileReadHandler localFiles(Path baseDir) {
        return filename -> {
            try {
                return CompletableFuture.completedFuture(
                        Files.readString(baseDir.resolve(filename), StandardCharsets.UTF_8));
            } catch (IOException e) {
                return CompletableFuture.failedFuture(e);
            }
        };
    }

    /**
     * Persist files a program wrote, one per name.
     */
    static void writeFiles(Map<String, List<String>> files, Path dir, PrintStream log) throws IOException {
        Files.createDirectories(dir);
        for (Map.Entry<String, List<String>> file : files.entrySet()) {
            Path target = dir.resolve(file.getKey());
            Files.write(target, file.getValue(), StandardCharsets.UTF_8);
            log.println("💾 Written: " + target + " (" + file.getValue().size() + " lines)");
        }
    }

    /**
     * Parse {@code a:b}; either part may be hex ({@code 0x400:64}).
     */
    static int[] parsePair(String range, String form) {
        String[] parts = range.split(":", -1);
        if (parts.length != 2) {
            throw new IllegalArgumentException("Expected " + form + ", got '" + range + "'");
        }
        return new int[] {Integer.decode(parts[0].trim()), Integer.decode(parts[1].trim())};
    }

    static String formatDuration(long ms) {
        if (ms < 1000) {
            return ms + " ms";
        } else if (ms < 60_000) {
            return String.format("%.1f sec", ms / 1000.0);
        } else {
            long minutes = ms / 60_000;
            long seconds = (ms % 60_000) / 1000;
            return String.format("%d min %d sec", minutes, seconds);
        }
    }
}
