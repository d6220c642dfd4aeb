package io.github.manjago.pseudomem.trace;

import java.util.List;

/**
 * Read-only access to recorded operations.
 */
public interface TraceLog {

    /**
     * All entries in step order. The returned list is unmodifiable.
     */
    List<TraceEntry> getTraceLog();

    int size();

    List<TraceEntry> getVariableTrace(String variable);

    /**
     * Entries whose address or pointer address equals {@code address}.
     */
    List<TraceEntry> getAddressTrace(int address);

    /**
     * Entries with {@code from <= step <= to}.
     */
    List<TraceEntry> getOperationsByStepRange(long from, long to);

    /**
     * Entries with {@code from <= line <= to}.
     */
    List<TraceEntry> getOperationsByLineRange(int from, int to);

    TraceStatistics getStatistics();

    /**
     * Human-readable report: statistics followed by every entry.
     */
    String generateReport();
}
