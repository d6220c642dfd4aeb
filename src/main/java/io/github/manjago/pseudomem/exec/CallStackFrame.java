package io.github.manjago.pseudomem.exec;

/**
 * Snapshot of one call-stack entry.
 *
 * @param line line currently executing in this frame
 */
public record CallStackFrame(String name, CallKind kind, int line) {

    @Override
    public String toString() {
        return kind == CallKind.MAIN ? name + " (line " + line + ")" : name + "() (line " + line + ")";
    }
}
