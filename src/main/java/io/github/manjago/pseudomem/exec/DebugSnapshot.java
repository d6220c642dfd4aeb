package io.github.manjago.pseudomem.exec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * State visible at a step boundary.
 *
 * @param callStack outermost frame first
 * @param variables variables visible from the current frame, by name
 */
public record DebugSnapshot(
    int currentLine,
    List<CallStackFrame> callStack,
    Map<String, VariableSnapshot> variables,
    boolean paused
) {

    public DebugSnapshot {
        callStack = List.copyOf(callStack);
        variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }
}
