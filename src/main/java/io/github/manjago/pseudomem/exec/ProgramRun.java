package io.github.manjago.pseudomem.exec;

import io.github.manjago.pseudomem.core.ProgramException;
import org.jetbrains.annotations.Nullable;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;

/**
 * Lazy sequence of output lines for one run, driving an {@link ExecutionSession}
 * through the handlers of {@link ExecutionOptions}.
 *
 * <p>Each {@link #next()} runs the program only as far as the next output line.
 * A handler completing with {@link CancellationException} ends the sequence early;
 * any other handler failure becomes a {@link ProgramException}.
 */
public final class ProgramRun implements Iterator<String> {

    private final ExecutionSession session;
    private final ExecutionOptions options;

    private @Nullable String nextLine;
    private boolean done = false;

    ProgramRun(ExecutionSession session, ExecutionOptions options) {
        this.session = session;
        this.options = options;
    }

    @Override
    public boolean hasNext() {
        if (nextLine != null) {
            return true;
        }
        if (done) {
            return false;
        }
        nextLine = pull();
        done = nextLine == null;
        return !done;
    }

    /**
     * @throws ProgramException on a run-time error
     */
    @Override
    public String next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Program has finished");
        }
        String line = nextLine;
        nextLine = null;
        return line;
    }

    public ExecutionSession getSession() {
        return session;
    }

    private @Nullable String pull() {
        while (true) {
            ExecutionSignal signal = session.resume();
            if (signal instanceof ExecutionSignal.Output output) {
                return output.line();
            }
            if (signal instanceof ExecutionSignal.Finished) {
                return null;
            }
            if (signal instanceof ExecutionSignal.InputRequired input) {
                String text = await(options.inputHandler().requestInput(input.variableName(), input.declaredType()),
                        "Input for '" + input.variableName() + "'");
                if (isCancelled()) {
                    return null;
                }
                session.provideInput(text != null ? text : "");
            } else if (signal instanceof ExecutionSignal.FileContentRequired file) {
                FileReadHandler handler = options.fileReadHandler();
                if (handler == null) {
                    throw session.fail("Cannot open '" + file.filename() + "' for reading: no file read handler", null);
                }
                String content = await(handler.readFile(file.filename()), "Reading file '" + file.filename() + "'");
                if (isCancelled()) {
                    return null;
                }
                session.provideFileContent(content != null ? content : "");
            } else if (signal instanceof ExecutionSignal.StepRequired) {
                StepHandler handler = options.stepHandler();
                if (handler != null) {
                    await(handler.awaitStep(session.debugSnapshot()), "Debug step");
                    if (isCancelled()) {
                        return null;
                    }
                }
                session.step();
            }
        }
    }

    private boolean isCancelled() {
        return session.getState() == SessionState.CANCELLED;
    }

    private <T> @Nullable T await(CompletionStage<T> stage, String what) {
        try {
            return stage.toCompletableFuture().join();
        } catch (CancellationException e) {
            session.cancel();
            return null;
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof CancellationException) {
                session.cancel();
                return null;
            }
            throw session.fail(what + " failed: " + cause.getMessage(), cause);
        }
    }
}
