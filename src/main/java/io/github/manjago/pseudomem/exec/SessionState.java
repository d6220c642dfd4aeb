package io.github.manjago.pseudomem.exec;

/**
 * Lifecycle of an {@link ExecutionSession}.
 */
public enum SessionState {
    /** Ready to run until the next signal */
    RUNNING,
    /** Waiting for {@link ExecutionSession#provideInput} */
    AWAITING_INPUT,
    /** Waiting for {@link ExecutionSession#provideFileContent} */
    AWAITING_FILE,
    /** Paused before a statement, waiting for {@link ExecutionSession#step} */
    AWAITING_STEP,
    FINISHED,
    CANCELLED,
    FAILED;

    public boolean isTerminal() {
        return this == FINISHED || this == CANCELLED || this == FAILED;
    }
}
