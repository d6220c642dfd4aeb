package io.github.manjago.pseudomem.debug;

import io.github.manjago.pseudomem.exec.CallStackFrame;
import io.github.manjago.pseudomem.exec.VariableSnapshot;
import io.github.manjago.pseudomem.trace.TraceEntry;

import java.util.ArrayList;
import java.util.List;

/**
 * State recorded before one statement of a debug run.
 *
 * Contains:
 * - the line about to run and the call stack
 * - visible variables
 * - live memory blocks with their slot values
 * - trace entries and output lines produced since the previous frame
 */
public record StepFrame(
    int step,
    int line,
    List<CallStackFrame> callStack,
    List<VariableSnapshot> variables,
    List<MemoryBlock> memory,
    List<TraceEntry> events,
    List<String> output
) {

    /**
     * One live allocation. Unwritten slots are null.
     */
    public record MemoryBlock(int address, String type, List<String> values) {
        public int end() {
            return address + values.size();
        }
    }

    /**
     * Builder for creating frames.
     */
    public static class Builder {
        private final int step;
        private final int line;
        private final List<CallStackFrame> callStack = new ArrayList<>();
        private final List<VariableSnapshot> variables = new ArrayList<>();
        private final List<MemoryBlock> memory = new ArrayList<>();
        private final List<TraceEntry> events = new ArrayList<>();
        private final List<String> output = new ArrayList<>();

        public Builder(int step, int line) {
            this.step = step;
            this.line = line;
        }

        public Builder callStack(List<CallStackFrame> frames) {
            callStack.addAll(frames);
            return this;
        }

        public Builder addVariable(VariableSnapshot variable) {
            variables.add(variable);
            return this;
        }

        public Builder addBlock(MemoryBlock block) {
            memory.add(block);
            return this;
        }

        public Builder addEvent(TraceEntry event) {
            events.add(event);
            return this;
        }

        public Builder addOutput(String line) {
            output.add(line);
            return this;
        }

        public StepFrame build() {
            return new StepFrame(step, line, List.copyOf(callStack), List.copyOf(variables),
                    List.copyOf(memory), List.copyOf(events), List.copyOf(output));
        }
    }
}
