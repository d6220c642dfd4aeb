package io.github.manjago.pseudomem.trace;

import io.github.manjago.pseudomem.core.Value;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.LongSupplier;
import java.util.function.Predicate;

/**
 * Append-only recorder of memory-affecting operations.
 *
 * <p>{@link #addEntry} is the only mutator; the helper methods below all go through it.
 * The evaluator writes here but never reads back.
 */
public class OperationTracer implements TraceLog {

    private final List<TraceEntry> entries = new ArrayList<>();
    private final LongSupplier clock;
    private final long startTime;
    private final boolean recordReads;
    private long stepCounter = 0;

    public OperationTracer() {
        this(System::currentTimeMillis, true);
    }

    /**
     * @param clock       millisecond clock, injectable for tests
     * @param recordReads whether READ entries are kept
     */
    public OperationTracer(LongSupplier clock, boolean recordReads) {
        this.clock = clock;
        this.startTime = clock.getAsLong();
        this.recordReads = recordReads;
    }

    /**
     * Tracer holding previously recorded entries, e.g. loaded from a run archive.
     */
    public static OperationTracer restore(List<TraceEntry> recorded) {
        OperationTracer tracer = new OperationTracer();
        tracer.entries.addAll(recorded);
        tracer.stepCounter = recorded.isEmpty() ? 0 : recorded.get(recorded.size() - 1).step();
        return tracer;
    }

    /**
     * Append an entry, assigning the next step number and a relative timestamp.
     */
    public TraceEntry addEntry(TraceOperation operation, int line, @Nullable Integer address,
                               @Nullable Integer pointerAddress, @Nullable Value value,
                               @Nullable String variable, Map<String, String> metadata) {
        TraceEntry entry = new TraceEntry(
                ++stepCounter,
                operation,
                line,
                clock.getAsLong() - startTime,
                address,
                pointerAddress,
                value != null ? value.display() : null,
                variable,
                metadata);
        entries.add(entry);
        return entry;
    }

    // ========== Logging helpers ==========

    public void logDeclare(int line, String variable, int address, String type) {
        addEntry(TraceOperation.DECLARE, line, address, null, null, variable, Map.of("type", type));
    }

    public void logWrite(int line, String variable, int address, Value value, @Nullable Value oldValue) {
        Map<String, String> metadata = oldValue != null ? Map.of("oldValue", oldValue.display()) : Map.of();
        addEntry(TraceOperation.WRITE, line, address, null, value, variable, metadata);
    }

    public void logRead(int line, @Nullable String variable, int address, Value value) {
        if (recordReads) {
            addEntry(TraceOperation.READ, line, address, null, value, variable, Map.of());
        }
    }

    public void logAllocate(int line, int address, int size, String type) {
        addEntry(TraceOperation.ALLOCATE, line, address, null, null, null,
                Map.of("size", Integer.toString(size), "type", type));
    }

    public void logFree(int line, int address, int size) {
        addEntry(TraceOperation.FREE, line, address, null, null, null, Map.of("size", Integer.toString(size)));
    }

    public void logAddressOf(int line, String variable, int address) {
        addEntry(TraceOperation.ADDRESS_OF, line, null, address, Value.address(address), variable, Map.of());
    }

    public void logDereference(int line, @Nullable String pointer, int pointerAddress, Value value) {
        addEntry(TraceOperation.DEREFERENCE, line, null, pointerAddress, value, pointer, Map.of());
    }

    public void logPointerAssign(int line, String pointer, int address, int target) {
        addEntry(TraceOperation.POINTER_ASSIGN, line, address, target, Value.address(target), pointer, Map.of());
    }

    // ========== TraceLog ==========

    @Override
    public List<TraceEntry> getTraceLog() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public List<TraceEntry> getVariableTrace(String variable) {
        return filter(e -> variable.equals(e.variable()));
    }

    @Override
    public List<TraceEntry> getAddressTrace(int address) {
        return filter(e -> e.involves(address));
    }

    @Override
    public List<TraceEntry> getOperationsByStepRange(long from, long to) {
        return filter(e -> e.step() >= from && e.step() <= to);
    }

    @Override
    public List<TraceEntry> getOperationsByLineRange(int from, int to) {
        return filter(e -> e.line() >= from && e.line() <= to);
    }

    @Override
    public TraceStatistics getStatistics() {
        return TraceStatistics.of(entries);
    }

    @Override
    public String generateReport() {
        return TraceReport.render(entries);
    }

    private List<TraceEntry> filter(Predicate<TraceEntry> predicate) {
        return entries.stream().filter(predicate).toList();
    }
}
