package io.github.manjago.pseudomem.trace;

import io.github.manjago.pseudomem.core.Value;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class OperationTracerTest {

    private AtomicLong clock;
    private OperationTracer tracer;

    @BeforeEach
    void setUp() {
        clock = new AtomicLong(1_000);
        tracer = new OperationTracer(clock::get, true);
    }

    /** x at 1024, p at 1025 pointing to x. */
    private void recordSample() {
        tracer.logDeclare(1, "x", 1024, "INTEGER");
        tracer.logDeclare(2, "p", 1025, "POINTER_TO_INTEGER");
        clock.addAndGet(5);
        tracer.logWrite(3, "x", 1024, Value.of(10), null);
        tracer.logAddressOf(4, "x", 1024);
        tracer.logPointerAssign(4, "p", 1025, 1024);
        tracer.logDereference(5, "p", 1024, Value.of(10));
        tracer.logRead(6, "x", 1024, Value.of(10));
    }

    @Nested
    @DisplayName("Recording")
    class Recording {

        @Test
        @DisplayName("Steps are consecutive from 1")
        void stepNumbers() {
            recordSample();
            List<TraceEntry> log = tracer.getTraceLog();
            assertEquals(7, log.size());
            for (int i = 0; i < log.size(); i++) {
                assertEquals(i + 1, log.get(i).step());
            }
        }

        @Test
        @DisplayName("Timestamps are relative to tracer creation")
        void relativeTimestamps() {
            recordSample();
            assertEquals(0, tracer.getTraceLog().get(0).timestamp());
            assertEquals(5, tracer.getTraceLog().get(2).timestamp());
        }

        @Test
        @DisplayName("Write keeps the previous value as metadata")
        void writeMetadata() {
            TraceEntry first = tracer.addEntry(TraceOperation.WRITE, 1, 1024, null, Value.of(1), "x", java.util.Map.of());
            tracer.logWrite(2, "x", 1024, Value.of(2), Value.of(1));
            TraceEntry second = tracer.getTraceLog().get(1);
            assertTrue(first.metadata().isEmpty());
            assertEquals("1", second.metadata().get("oldValue"));
            assertEquals("2", second.value());
        }

        @Test
        @DisplayName("Reads are skipped when read recording is off")
        void readsDisabled() {
            OperationTracer quiet = new OperationTracer(clock::get, false);
            quiet.logRead(1, "x", 1024, Value.of(1));
            quiet.logWrite(1, "x", 1024, Value.of(1), null);
            assertEquals(1, quiet.size());
            assertEquals(TraceOperation.WRITE, quiet.getTraceLog().get(0).operation());
        }

        @Test
        @DisplayName("Returned log is a read-only copy")
        void unmodifiableLog() {
            recordSample();
            List<TraceEntry> log = tracer.getTraceLog();
            assertThrows(UnsupportedOperationException.class, log::clear);
            tracer.logFree(7, 1024, 1);
            assertEquals(7, log.size());
        }
    }

    @Nested
    @DisplayName("Queries")
    class Queries {

        @BeforeEach
        void record() {
            recordSample();
        }

        @Test
        @DisplayName("Variable trace")
        void byVariable() {
            List<TraceEntry> entries = tracer.getVariableTrace("x");
            assertEquals(4, entries.size());
            assertTrue(entries.stream().allMatch(e -> "x".equals(e.variable())));
        }

        @Test
        @DisplayName("Address trace includes pointer targets")
        void byAddress() {
            List<TraceEntry> entries = tracer.getAddressTrace(1024);
            assertEquals(6, entries.size());
            assertTrue(entries.stream().anyMatch(e -> e.operation() == TraceOperation.POINTER_ASSIGN));
        }

        @Test
        @DisplayName("Step and line ranges are inclusive")
        void ranges() {
            assertEquals(3, tracer.getOperationsByStepRange(2, 4).size());
            assertEquals(3, tracer.getOperationsByLineRange(4, 5).size());
            assertTrue(tracer.getOperationsByLineRange(50, 60).isEmpty());
        }

        @Test
        @DisplayName("Statistics by operation group")
        void statistics() {
            TraceStatistics stats = tracer.getStatistics();
            assertEquals(7, stats.total());
            assertEquals(2, stats.declares());
            assertEquals(1, stats.reads());
            assertEquals(1, stats.writes());
            assertEquals(3, stats.pointerOps());
            assertEquals(0, stats.allocations());
        }

        @Test
        @DisplayName("Report has header and one line per entry")
        void report() {
            String report = tracer.generateReport();
            assertTrue(report.contains("MEMORY TRACE REPORT"));
            assertTrue(report.contains("Detailed log:"));
            assertTrue(report.contains("ADDRESS_OF"));
        }
    }

    @Test
    @DisplayName("Restored tracer continues numbering after the last step")
    void restore() {
        recordSample();
        OperationTracer restored = OperationTracer.restore(tracer.getTraceLog());
        assertEquals(7, restored.size());
        TraceEntry next = restored.addEntry(TraceOperation.FREE, 8, 1024, null, null, null, java.util.Map.of());
        assertEquals(8, next.step());
    }

    @Test
    @DisplayName("Empty report says so")
    void emptyReport() {
        assertTrue(tracer.generateReport().contains("(no operations recorded)"));
    }
}
