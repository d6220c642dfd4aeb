package io.github.manjago.pseudomem.exec;

import io.github.manjago.pseudomem.core.ProgramException;

/**
 * Listener for execution events.
 *
 * Implement this interface to follow a run, for example to log calls
 * or collect statistics. All methods are called on the executing thread.
 */
public interface ExecutionListener {

    /**
     * Called when a procedure or function is entered.
     *
     * @param frame the new frame
     * @param depth call depth after entering (1 for a call made from main)
     */
    default void onCallEnter(CallStackFrame frame, int depth) {}

    /**
     * Called when a procedure or function returns normally.
     */
    default void onCallExit(CallStackFrame frame, int depth) {}

    /**
     * Called for every line produced on the output stream.
     */
    default void onOutput(String line) {}

    /**
     * Called once when the run fails.
     */
    default void onFailure(ProgramException error) {}

    /**
     * No-op listener that does nothing.
     */
    ExecutionListener NOOP = new ExecutionListener() {};
}
