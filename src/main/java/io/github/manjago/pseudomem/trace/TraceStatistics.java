package io.github.manjago.pseudomem.trace;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-operation counts over a trace log.
 */
public record TraceStatistics(int total, Map<TraceOperation, Integer> counts) {

    public TraceStatistics {
        counts = Map.copyOf(counts);
    }

    public static TraceStatistics of(Collection<TraceEntry> entries) {
        Map<TraceOperation, Integer> counts = new EnumMap<>(TraceOperation.class);
        for (TraceOperation op : TraceOperation.values()) {
            counts.put(op, 0);
        }
        for (TraceEntry entry : entries) {
            counts.merge(entry.operation(), 1, Integer::sum);
        }
        return new TraceStatistics(entries.size(), counts);
    }

    public int count(TraceOperation operation) {
        return counts.getOrDefault(operation, 0);
    }

    public int declares() {
        return count(TraceOperation.DECLARE);
    }

    public int reads() {
        return count(TraceOperation.READ);
    }

    public int writes() {
        return count(TraceOperation.WRITE);
    }

    public int allocations() {
        return count(TraceOperation.ALLOCATE);
    }

    public int frees() {
        return count(TraceOperation.FREE);
    }

    public int pointerOps() {
        return count(TraceOperation.ADDRESS_OF) + count(TraceOperation.DEREFERENCE)
                + count(TraceOperation.POINTER_ASSIGN);
    }

    @Override
    public String toString() {
        return String.format("""
            Total operations:    %,d
            Declarations:        %,d
            Reads:               %,d
            Writes:              %,d
            Allocations:         %,d
            Frees:               %,d
            Pointer operations:  %,d""",
            total, declares(), reads(), writes(), allocations(), frees(), pointerOps());
    }
}
