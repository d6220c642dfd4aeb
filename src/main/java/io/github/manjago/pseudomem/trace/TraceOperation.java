package io.github.manjago.pseudomem.trace;

/**
 * Memory-affecting operations recorded by the tracer.
 */
public enum TraceOperation {
    DECLARE,
    READ,
    WRITE,
    ALLOCATE,
    FREE,
    ADDRESS_OF,
    DEREFERENCE,
    POINTER_ASSIGN;

    public boolean isPointerOperation() {
        return this == ADDRESS_OF || this == DEREFERENCE || this == POINTER_ASSIGN;
    }
}
