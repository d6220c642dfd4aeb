package io.github.manjago.pseudomem.persistence;

import io.github.manjago.pseudomem.core.Allocation;
import io.github.manjago.pseudomem.core.MemoryStats;
import io.github.manjago.pseudomem.core.ProgramException;
import io.github.manjago.pseudomem.exec.ExecutionSession;
import io.github.manjago.pseudomem.trace.OperationTracer;
import io.github.manjago.pseudomem.trace.TraceEntry;
import io.github.manjago.pseudomem.trace.TraceLog;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Everything kept from one finished or failed run.
 *
 * @param failure run-time error message, or null if the run did not fail
 */
public record TraceArchive(
    String source,
    List<String> output,
    List<TraceEntry> entries,
    List<Allocation> allocations,
    MemoryStats memory,
    long iterations,
    long seed,
    @Nullable String failure
) {

    public TraceArchive {
        output = List.copyOf(output);
        entries = List.copyOf(entries);
        allocations = List.copyOf(allocations);
    }

    /**
     * Capture a session's results. The session may still be running; whatever it has done so far is kept.
     */
    public static TraceArchive of(String source, ExecutionSession session) {
        ProgramException failure = session.getFailure();
        return new TraceArchive(
            source,
            session.getOutputLog(),
            session.getTrace().getTraceLog(),
            session.getMemory().getAllocations(),
            session.getMemory().getStats(),
            session.getStats().iterations(),
            session.getRandomSeed(),
            failure != null ? failure.getMessage() : null
        );
    }

    public boolean failed() {
        return failure != null;
    }

    /**
     * Query view over the archived entries.
     */
    public TraceLog trace() {
        return OperationTracer.restore(entries);
    }
}
