package io.github.manjago.pseudomem.core;

/**
 * Run-time error raised while executing a program.
 *
 * <p>Carries the source line of the statement or expression that failed
 * (0 when raised outside any statement, e.g. directly by the arena).
 */
public class ProgramException extends RuntimeException {

    private final int line;
    private final String detail;

    public ProgramException(String detail, int line) {
        this(detail, line, null);
    }

    public ProgramException(String detail, int line, Throwable cause) {
        super(format(detail, line), cause);
        this.line = line;
        this.detail = detail;
    }

    public int getLine() {
        return line;
    }

    /** Message without the line prefix. */
    public String getDetail() {
        return detail;
    }

    /**
     * Same error attributed to another line. Returns this when the line is already known.
     */
    public ProgramException withLine(int newLine) {
        if (line > 0 || newLine <= 0) {
            return this;
        }
        return new ProgramException(detail, newLine, this);
    }

    private static String format(String detail, int line) {
        return line > 0
                ? "Runtime error at line " + line + ": " + detail
                : "Runtime error: " + detail;
    }
}
