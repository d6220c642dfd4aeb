package io.github.manjago.pseudomem.exec;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Supplies values for INPUT statements.
 */
@FunctionalInterface
public interface InputHandler {

    /**
     * @param variableName target name, e.g. {@code x} or {@code grid[2, 3]}
     * @param declaredType declared type of the target
     * @return the entered text; completing with a {@link java.util.concurrent.CancellationException}
     *         cancels the run
     */
    CompletionStage<String> requestInput(String variableName, String declaredType);

    /**
     * Handler answering from a fixed list, failing once it runs out.
     */
    static InputHandler scripted(String... values) {
        Deque<String> queue = new ArrayDeque<>(Arrays.asList(values));
        return (name, type) -> queue.isEmpty()
                ? CompletableFuture.failedFuture(new IllegalStateException("No input left for '" + name + "'"))
                : CompletableFuture.completedFuture(queue.poll());
    }

    /**
     * Handler that refuses every request.
     */
    InputHandler NONE = (name, type) -> CompletableFuture.failedFuture(
            new IllegalStateException("No input available for '" + name + "'"));
}
