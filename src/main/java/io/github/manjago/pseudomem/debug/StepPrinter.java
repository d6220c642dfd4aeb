package io.github.manjago.pseudomem.debug;

import io.github.manjago.pseudomem.exec.CallStackFrame;
import io.github.manjago.pseudomem.exec.VariableSnapshot;
import io.github.manjago.pseudomem.trace.TraceEntry;

import java.io.PrintStream;
import java.util.List;

/**
 * Prints recorded step frames in human-readable format.
 */
public class StepPrinter {

    private final PrintStream out;
    private boolean showVariables = true;
    private boolean showEvents = true;
    private boolean showMemory = true;
    private boolean compactMode = false;

    public StepPrinter() {
        this(System.out);
    }

    public StepPrinter(PrintStream out) {
        this.out = out;
    }

    public StepPrinter showVariables(boolean show) {
        this.showVariables = show;
        return this;
    }

    public StepPrinter showEvents(boolean show) {
        this.showEvents = show;
        return this;
    }

    public StepPrinter showMemory(boolean show) {
        this.showMemory = show;
        return this;
    }

    public StepPrinter compactMode(boolean compact) {
        this.compactMode = compact;
        return this;
    }

    /**
     * Print all frames.
     */
    public void printAll(List<StepFrame> frames) {
        for (int i = 0; i < frames.size(); i++) {
            if (i > 0) {
                out.println();
            }
            printFrame(frames.get(i));
        }
    }

    /**
     * Print single frame.
     */
    public void printFrame(StepFrame frame) {
        out.println("═".repeat(70));
        out.printf("STEP %d | Line %d | %s%n", frame.step(), frame.line(), stackLine(frame.callStack()));
        out.println("═".repeat(70));

        if (!frame.output().isEmpty()) {
            out.println();
            out.println("📤 Output:");
            for (String line : frame.output()) {
                out.println("  " + line);
            }
        }

        if (showEvents && !frame.events().isEmpty()) {
            out.println();
            out.println("📋 Events:");
            for (TraceEntry event : frame.events()) {
                out.printf("  %s %s%n", icon(event), event);
            }
        }

        if (showVariables) {
            out.println();
            out.println("📦 Variables (" + frame.variables().size() + "):");
            for (VariableSnapshot variable : frame.variables()) {
                out.println("  " + variable);
            }
        }

        if (showMemory && !frame.memory().isEmpty()) {
            out.println();
            out.println("💾 Memory (" + frame.memory().size() + " blocks):");
            for (StepFrame.MemoryBlock block : frame.memory()) {
                printBlock(block);
            }
        }
    }

    /**
     * Print frame summary (one line per frame).
     */
    public void printSummary(List<StepFrame> frames) {
        out.println("Step | Line | Depth | Vars | Events | Blocks");
        out.println("-----+------+-------+------+--------+-------");

        for (StepFrame f : frames) {
            out.printf("%4d | %4d | %5d | %4d | %6d | %d%n",
                f.step(), f.line(), f.callStack().size() - 1, f.variables().size(),
                f.events().size(), f.memory().size());
        }
    }

    // ========== Private helpers ==========

    private static String stackLine(List<CallStackFrame> callStack) {
        StringBuilder sb = new StringBuilder();
        for (CallStackFrame frame : callStack) {
            if (sb.length() > 0) {
                sb.append(" → ");
            }
            sb.append(frame.name());
        }
        return sb.toString();
    }

    private static String icon(TraceEntry event) {
        return switch (event.operation()) {
            case DECLARE -> "🆕";
            case READ -> "👁";
            case WRITE -> "✏️";
            case ALLOCATE -> "📦";
            case FREE -> "🗑";
            case ADDRESS_OF, DEREFERENCE, POINTER_ASSIGN -> "👉";
        };
    }

    private void printBlock(StepFrame.MemoryBlock block) {
        out.printf("  [0x%04X..0x%04X] %s (%d slots)%n",
            block.address(), block.end() - 1, block.type(), block.values().size());

        if (compactMode) {
            return;
        }

        List<String> values = block.values();
        for (int i = 0; i < values.size(); i++) {
            String value = values.get(i);
            out.printf("    0x%04X: %s%n", block.address() + i, value != null ? value : "??");
        }
    }
}
