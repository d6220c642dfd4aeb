package io.github.manjago.pseudomem.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.nio.file.Path;

/**
 * Configuration for one interpreter run.
 *
 * Loads from HOCON files using typesafe-config.
 * Default values are in reference.conf.
 */
public record InterpreterConfig(
    // Arena
    int memorySize,
    int reservedSize,

    // Budgets
    int maxIterations,
    int maxRecursionDepth,

    // Files
    boolean echoFileWrites,

    // Tracing
    boolean recordReads,

    // RANDOM()
    long randomSeed,          // 0 = derive from clock

    // Pause before every statement
    boolean debugMode
) {

    public InterpreterConfig {
        if (memorySize <= 0) {
            throw new IllegalArgumentException("memory.size must be positive: " + memorySize);
        }
        if (reservedSize < 0 || reservedSize >= memorySize) {
            throw new IllegalArgumentException("memory.reserved must be in [0, memory.size): " + reservedSize);
        }
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("limits.max-iterations must be positive: " + maxIterations);
        }
        if (maxRecursionDepth <= 0) {
            throw new IllegalArgumentException("limits.max-recursion-depth must be positive: " + maxRecursionDepth);
        }
    }

    /**
     * Load default configuration.
     */
    public static InterpreterConfig defaults() {
        return fromConfig(ConfigFactory.load());
    }

    /**
     * Load configuration from a specific file, falling back to defaults.
     */
    public static InterpreterConfig fromFile(Path configFile) {
        Config fileConfig = ConfigFactory.parseFile(configFile.toFile());
        Config merged = fileConfig.withFallback(ConfigFactory.load());
        return fromConfig(merged);
    }

    /**
     * Load from Config object.
     */
    public static InterpreterConfig fromConfig(Config config) {
        Config c = config.getConfig("pseudomem");

        return new InterpreterConfig(
            c.getInt("memory.size"),
            c.getInt("memory.reserved"),
            c.getInt("limits.max-iterations"),
            c.getInt("limits.max-recursion-depth"),
            c.getBoolean("files.echo-writes"),
            c.getBoolean("trace.record-reads"),
            c.getLong("random.seed"),
            c.getBoolean("debug.enabled")
        );
    }

    /**
     * Seed actually used for RANDOM().
     */
    public long effectiveSeed() {
        return randomSeed != 0 ? randomSeed : System.nanoTime();
    }

    /**
     * Builder for programmatic configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder pre-filled with this configuration's values.
     */
    public Builder toBuilder() {
        return new Builder()
                .memorySize(memorySize)
                .reservedSize(reservedSize)
                .maxIterations(maxIterations)
                .maxRecursionDepth(maxRecursionDepth)
                .echoFileWrites(echoFileWrites)
                .recordReads(recordReads)
                .randomSeed(randomSeed)
                .debugMode(debugMode);
    }

    public static class Builder {
        private int memorySize = 65_536;
        private int reservedSize = 1024;
        private int maxIterations = 10_000;
        private int maxRecursionDepth = 1000;
        private boolean echoFileWrites = true;
        private boolean recordReads = true;
        private long randomSeed = 0;
        private boolean debugMode = false;

        public Builder memorySize(int size) { this.memorySize = size; return this; }
        public Builder reservedSize(int size) { this.reservedSize = size; return this; }
        public Builder maxIterations(int max) { this.maxIterations = max; return this; }
        public Builder maxRecursionDepth(int max) { this.maxRecursionDepth = max; return this; }
        public Builder echoFileWrites(boolean echo) { this.echoFileWrites = echo; return this; }
        public Builder recordReads(boolean record) { this.recordReads = record; return this; }
        public Builder randomSeed(long seed) { this.randomSeed = seed; return this; }
        public Builder debugMode(boolean debug) { this.debugMode = debug; return this; }

        public InterpreterConfig build() {
            return new InterpreterConfig(
                memorySize, reservedSize, maxIterations, maxRecursionDepth,
                echoFileWrites, recordReads, randomSeed, debugMode
            );
        }
    }

    @Override
    public String toString() {
        return String.format("""
            InterpreterConfig:
              memory.size:                %,d slots
              memory.reserved:            %,d slots
              limits.max-iterations:      %,d
              limits.max-recursion-depth: %,d
              files.echo-writes:          %s
              trace.record-reads:         %s
              random.seed:                %s
              debug.enabled:              %s
            """,
            memorySize,
            reservedSize,
            maxIterations,
            maxRecursionDepth,
            echoFileWrites,
            recordReads,
            randomSeed == 0 ? "clock" : Long.toString(randomSeed),
            debugMode
        );
    }
}
