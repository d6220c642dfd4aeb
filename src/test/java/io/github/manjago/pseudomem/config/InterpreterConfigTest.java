package io.github.manjago.pseudomem.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class InterpreterConfigTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Defaults come from reference.conf")
    void defaults() {
        InterpreterConfig config = InterpreterConfig.defaults();
        assertEquals(65_536, config.memorySize());
        assertEquals(1024, config.reservedSize());
        assertEquals(10_000, config.maxIterations());
        assertEquals(1000, config.maxRecursionDepth());
        assertTrue(config.echoFileWrites());
        assertTrue(config.recordReads());
        assertEquals(0, config.randomSeed());
        assertFalse(config.debugMode());
    }

    @Test
    @DisplayName("File values override defaults, the rest falls back")
    void fromFile() throws IOException {
        Path file = tempDir.resolve("custom.conf");
        Files.writeString(file, """
                pseudomem {
                  limits.max-iterations = 500
                  random.seed = 42
                  files.echo-writes = false
                }
                """);

        InterpreterConfig config = InterpreterConfig.fromFile(file);
        assertEquals(500, config.maxIterations());
        assertEquals(42, config.randomSeed());
        assertFalse(config.echoFileWrites());
        assertEquals(65_536, config.memorySize());
    }

    @Test
    @DisplayName("Builder matches defaults and toBuilder copies values")
    void builder() {
        InterpreterConfig built = InterpreterConfig.builder().build();
        assertEquals(InterpreterConfig.defaults(), built);

        InterpreterConfig changed = built.toBuilder().maxRecursionDepth(10).build();
        assertEquals(10, changed.maxRecursionDepth());
        assertEquals(built.memorySize(), changed.memorySize());
    }

    @Test
    @DisplayName("Invalid values are rejected")
    void validation() {
        assertThrows(IllegalArgumentException.class,
                () -> InterpreterConfig.builder().memorySize(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> InterpreterConfig.builder().memorySize(100).reservedSize(100).build());
        assertThrows(IllegalArgumentException.class,
                () -> InterpreterConfig.builder().maxIterations(0).build());
    }

    @Test
    @DisplayName("Fixed seed is used as is")
    void effectiveSeed() {
        assertEquals(7, InterpreterConfig.builder().randomSeed(7).build().effectiveSeed());
    }
}
