package io.github.manjago.pseudomem.trace;

import org.jetbrains.annotations.Nullable;

import java.util.Map;

/**
 * One recorded operation. Immutable.
 *
 * @param step          strictly increasing, starting at 1
 * @param timestamp     milliseconds since the tracer was created
 * @param address       slot the operation touched, if any
 * @param pointerAddress address a pointer refers to (ADDRESS_OF, DEREFERENCE, POINTER_ASSIGN)
 * @param value         display form of the value involved
 * @param variable      variable name involved
 * @param metadata      free-form details, e.g. {@code type}, {@code size}, {@code oldValue}
 */
public record TraceEntry(
    long step,
    TraceOperation operation,
    int line,
    long timestamp,
    @Nullable Integer address,
    @Nullable Integer pointerAddress,
    @Nullable String value,
    @Nullable String variable,
    Map<String, String> metadata
) {

    public TraceEntry {
        metadata = Map.copyOf(metadata);
    }

    /**
     * True if the entry touches the address directly or through a pointer.
     */
    public boolean involves(int addr) {
        return (address != null && address == addr) || (pointerAddress != null && pointerAddress == addr);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Step %4d | Line %3d | %-14s", step, line, operation));
        if (variable != null) {
            sb.append(" | ").append(variable);
        }
        if (address != null) {
            sb.append(String.format(" @ 0x%04X", address));
        }
        if (pointerAddress != null) {
            sb.append(String.format(" -> 0x%04X", pointerAddress));
        }
        if (value != null) {
            sb.append(" = ").append(value);
        }
        if (!metadata.isEmpty()) {
            sb.append(" |");
            metadata.entrySet().stream()
                    .sorted(Map.Entry.comparingByKey())
                    .forEach(e -> sb.append(' ').append(e.getKey()).append('=').append(e.getValue()));
        }
        return sb.toString();
    }
}
