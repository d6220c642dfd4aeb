package io.github.manjago.pseudomem.trace;

import java.util.List;

/**
 * Text rendering of a trace log.
 */
public final class TraceReport {

    private static final int WIDTH = 80;

    private TraceReport() {
    }

    public static String render(List<TraceEntry> entries) {
        StringBuilder sb = new StringBuilder();
        sb.append("=".repeat(WIDTH)).append('\n');
        sb.append("MEMORY TRACE REPORT").append('\n');
        sb.append("=".repeat(WIDTH)).append('\n');
        sb.append('\n');
        sb.append("Statistics:").append('\n');
        for (String line : TraceStatistics.of(entries).toString().split("\n")) {
            sb.append("  ").append(line).append('\n');
        }
        sb.append('\n');
        sb.append("Detailed log:").append('\n');
        sb.append("-".repeat(WIDTH)).append('\n');
        for (TraceEntry entry : entries) {
            sb.append(entry).append('\n');
        }
        if (entries.isEmpty()) {
            sb.append("(no operations recorded)").append('\n');
        }
        sb.append("=".repeat(WIDTH)).append('\n');
        return sb.toString();
    }
}
