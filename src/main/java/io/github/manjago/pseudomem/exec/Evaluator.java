package io.github.manjago.pseudomem.exec;

import io.github.manjago.pseudomem.config.InterpreterConfig;
import io.github.manjago.pseudomem.core.MemoryArena;
import io.github.manjago.pseudomem.core.MemoryView;
import io.github.manjago.pseudomem.lang.Program;
import io.github.manjago.pseudomem.trace.OperationTracer;
import io.github.manjago.pseudomem.trace.TraceLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for running a parsed {@link Program}.
 *
 * <p>An evaluator owns one memory arena and one tracer and runs exactly one program.
 * To run again, create a new evaluator.
 *
 * <pre>{@code
 * Evaluator evaluator = new Evaluator(config);
 * ProgramRun run = evaluator.executeProgram(Parser.parse(source), ExecutionOptions.defaults(config));
 * run.forEachRemaining(System.out::println);
 * }</pre>
 */
public final class Evaluator {

    private static final Logger log = LoggerFactory.getLogger(Evaluator.class);

    private final InterpreterConfig config;
    private final MemoryArena arena;
    private final OperationTracer tracer;

    private ExecutionListener listener = ExecutionListener.NOOP;
    private ExecutionSession session;

    public Evaluator(InterpreterConfig config) {
        this.config = config;
        this.arena = new MemoryArena(config.memorySize(), config.reservedSize());
        this.tracer = new OperationTracer(System::currentTimeMillis, config.recordReads());
    }

    public Evaluator() {
        this(InterpreterConfig.defaults());
    }

    /**
     * Set listener for call and output events. Must be set before the program starts.
     */
    public Evaluator setListener(ExecutionListener listener) {
        this.listener = listener != null ? listener : ExecutionListener.NOOP;
        return this;
    }

    /**
     * Run a program as a lazy sequence of output lines, answering suspensions with the
     * handlers in {@code options}. Debug pauses happen only when a step handler is given.
     */
    public ProgramRun executeProgram(Program program, ExecutionOptions options) {
        boolean debug = options.debugMode() && options.stepHandler() != null;
        return new ProgramRun(open(program, debug, options.echoFileWrites()), options);
    }

    /**
     * Start a session the caller drives signal by signal.
     */
    public ExecutionSession start(Program program) {
        return start(program, ExecutionOptions.defaults(config));
    }

    public ExecutionSession start(Program program, ExecutionOptions options) {
        return open(program, options.debugMode(), options.echoFileWrites());
    }

    private ExecutionSession open(Program program, boolean debugMode, boolean echoFileWrites) {
        if (session != null) {
            throw new IllegalStateException("Evaluator has already run a program; create a new one");
        }
        ExecutionState state = new ExecutionState(config, arena, tracer);
        state.listener = listener;
        session = new ExecutionSession(state, program, debugMode, echoFileWrites);
        log.debug("Session opened with {}", config);
        return session;
    }

    public InterpreterConfig getConfig() {
        return config;
    }

    public MemoryView getMemory() {
        return arena;
    }

    public TraceLog getTrace() {
        return tracer;
    }
}
