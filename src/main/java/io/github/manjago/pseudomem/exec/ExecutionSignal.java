package io.github.manjago.pseudomem.exec;

/**
 * What {@link ExecutionSession#resume()} stopped for.
 */
public sealed interface ExecutionSignal {

    /** One line of program output. */
    record Output(String line) implements ExecutionSignal {}

    /** INPUT needs a value for the named target. */
    record InputRequired(String variableName, String declaredType, int line) implements ExecutionSignal {}

    /** OPENFILE ... FOR READ needs the file's content. */
    record FileContentRequired(String filename, int line) implements ExecutionSignal {}

    /** Debug mode paused before the statement on {@code line}. */
    record StepRequired(int line) implements ExecutionSignal {}

    /** The program ended, normally or by cancellation. */
    record Finished(boolean cancelled) implements ExecutionSignal {}
}
