package io.github.manjago.pseudomem.exec;

import io.github.manjago.pseudomem.config.InterpreterConfig;
import org.jetbrains.annotations.Nullable;

/**
 * Handlers and switches for one program run.
 *
 * @param debugMode      pause before each statement; ignored by {@link ProgramRun} without a step handler
 * @param echoFileWrites also emit {@code [Write to f] data} for every WRITEFILE
 */
public record ExecutionOptions(
    InputHandler inputHandler,
    boolean debugMode,
    @Nullable StepHandler stepHandler,
    boolean echoFileWrites,
    @Nullable FileReadHandler fileReadHandler
) {

    /**
     * Options taken from configuration, with no handlers.
     */
    public static ExecutionOptions defaults(InterpreterConfig config) {
        return builder(config).build();
    }

    public static Builder builder(InterpreterConfig config) {
        return new Builder()
                .debugMode(config.debugMode())
                .echoFileWrites(config.echoFileWrites());
    }

    public static class Builder {
        private InputHandler inputHandler = InputHandler.NONE;
        private boolean debugMode = false;
        private StepHandler stepHandler;
        private boolean echoFileWrites = true;
        private FileReadHandler fileReadHandler;

        public Builder inputHandler(InputHandler handler) { this.inputHandler = handler; return this; }
        public Builder debugMode(boolean debug) { this.debugMode = debug; return this; }
        public Builder stepHandler(StepHandler handler) { this.stepHandler = handler; return this; }
        public Builder echoFileWrites(boolean echo) { this.echoFileWrites = echo; return this; }
        public Builder fileReadHandler(FileReadHandler handler) { this.fileReadHandler = handler; return this; }

        public ExecutionOptions build() {
            return new ExecutionOptions(inputHandler, debugMode, stepHandler, echoFileWrites, fileReadHandler);
        }
    }
}
