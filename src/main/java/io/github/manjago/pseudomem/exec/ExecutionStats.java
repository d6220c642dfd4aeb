package io.github.manjago.pseudomem.exec;

import io.github.manjago.pseudomem.core.MemoryStats;

/**
 * Snapshot of run statistics.
 *
 * @param iterations statement dispatches plus loop iterations counted against the budget
 */
public record ExecutionStats(
    long iterations,
    int calls,
    int maxCallDepth,
    int outputLines,
    int traceEntries,
    MemoryStats memory,
    long elapsedMillis
) {

    @Override
    public String toString() {
        return String.format("""
            === Execution Statistics ===
            Iterations:     %,d
            Calls:          %,d (max depth %d)
            Output lines:   %,d
            Trace entries:  %,d
            %s
            Elapsed:        %,d ms""",
            iterations, calls, maxCallDepth, outputLines, traceEntries, memory, elapsedMillis);
    }
}
