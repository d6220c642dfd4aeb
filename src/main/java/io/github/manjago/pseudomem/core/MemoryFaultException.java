package io.github.manjago.pseudomem.core;

/**
 * Run-time error raised by the memory arena.
 */
public class MemoryFaultException extends ProgramException {

    private final MemoryFault fault;

    public MemoryFaultException(MemoryFault fault, String detail) {
        this(fault, detail, 0, null);
    }

    private MemoryFaultException(MemoryFault fault, String detail, int line, Throwable cause) {
        super(detail, line, cause);
        this.fault = fault;
    }

    public MemoryFault getFault() {
        return fault;
    }

    @Override
    public MemoryFaultException withLine(int newLine) {
        if (getLine() > 0 || newLine <= 0) {
            return this;
        }
        return new MemoryFaultException(fault, getDetail(), newLine, this);
    }
}
