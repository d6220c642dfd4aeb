package io.github.manjago.pseudomem.exec;

/**
 * What a call-stack frame is executing.
 */
public enum CallKind {
    MAIN,
    PROCEDURE,
    FUNCTION
}
