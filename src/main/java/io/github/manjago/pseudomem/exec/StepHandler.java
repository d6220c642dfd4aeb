package io.github.manjago.pseudomem.exec;

import java.util.concurrent.CompletionStage;

/**
 * Grants debug steps. Called before every statement when debug mode is on.
 */
@FunctionalInterface
public interface StepHandler {

    /**
     * @param snapshot state before the statement executes
     * @return completes when the statement may run; completing with a
     *         {@link java.util.concurrent.CancellationException} stops the run
     */
    CompletionStage<Void> awaitStep(DebugSnapshot snapshot);
}
