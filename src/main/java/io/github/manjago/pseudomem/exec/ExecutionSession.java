package io.github.manjago.pseudomem.exec;

import io.github.manjago.pseudomem.core.MemoryView;
import io.github.manjago.pseudomem.core.ProgramException;
import io.github.manjago.pseudomem.core.Value;
import io.github.manjago.pseudomem.lang.Expr;
import io.github.manjago.pseudomem.lang.FileMode;
import io.github.manjago.pseudomem.lang.Program;
import io.github.manjago.pseudomem.lang.Stmt;
import io.github.manjago.pseudomem.trace.TraceLog;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.StringJoiner;

/**
 * One suspendable program run.
 *
 * <p>Top-level code and procedure bodies run on an explicit stack of frames, so the
 * run can stop at any statement boundary and pick up again later. Each call to
 * {@link #resume()} runs until the next {@link ExecutionSignal}:
 * <ul>
 *   <li>{@code Output} - one line, in program order</li>
 *   <li>{@code InputRequired} - answer with {@link #provideInput}</li>
 *   <li>{@code FileContentRequired} - answer with {@link #provideFileContent}</li>
 *   <li>{@code StepRequired} - debug mode only; answer with {@link #step}</li>
 *   <li>{@code Finished} - normal end or {@link #cancel}</li>
 * </ul>
 * A run-time error is thrown from whichever call hit it, and the session becomes FAILED.
 * Memory, trace and call stack stay readable afterwards.
 *
 * <p>Not thread-safe. One session per {@link Evaluator}.
 */
public final class ExecutionSession {

    private static final Logger log = LoggerFactory.getLogger(ExecutionSession.class);

    private final ExecutionState state;
    private final ExpressionEvaluator expressions;
    private final StatementSupport support;
    private final Program program;
    private final boolean debugMode;
    private final boolean echoFileWrites;

    private final Deque<Frame> frames = new ArrayDeque<>();
    private final List<String> outputLog = new ArrayList<>();

    private SessionState sessionState = SessionState.RUNNING;
    private boolean started = false;
    private @Nullable Stmt held;
    private @Nullable String pendingLine;
    private @Nullable PendingInput pendingInput;
    private @Nullable PendingFile pendingFile;
    private @Nullable ProgramException failure;
    private @Nullable List<CallStackFrame> failureStack;

    private long startedAt;
    private long finishedAt;

    private record PendingInput(Location location, int line) {}

    private record PendingFile(String name, int line) {}

    ExecutionSession(ExecutionState state, Program program, boolean debugMode, boolean echoFileWrites) {
        this.state = state;
        this.program = program;
        this.debugMode = debugMode;
        this.echoFileWrites = echoFileWrites;
        this.expressions = new ExpressionEvaluator(state);
        this.support = new StatementSupport(state, expressions);
        this.expressions.bindFunctions(new FunctionExecutor(state, support, expressions));
    }

    // ========== Frames ==========

    /**
     * A running block. {@link #next()} hands out statements until the block is done.
     */
    private abstract static class Frame {
        final List<Stmt> body;
        final Scope scope;
        int index;

        Frame(List<Stmt> body, Scope scope, int index) {
            this.body = body;
            this.scope = scope;
            this.index = index;
        }

        abstract @Nullable Stmt next();

        void onExit() {}
    }

    private static class BlockFrame extends Frame {
        final boolean topLevel;

        BlockFrame(List<Stmt> body, Scope scope, boolean topLevel) {
            super(body, scope, 0);
            this.topLevel = topLevel;
        }

        @Override
        @Nullable Stmt next() {
            return index < body.size() ? body.get(index++) : null;
        }
    }

    private final class ProcedureFrame extends BlockFrame {
        private final int callLine;

        ProcedureFrame(Stmt.Procedure procedure, Scope scope, int callLine) {
            super(procedure.body(), scope, false);
            this.callLine = callLine;
        }

        @Override
        void onExit() {
            support.exitCall(scope, callLine);
        }
    }

    private final class WhileFrame extends Frame {
        private final Stmt.While statement;

        WhileFrame(Stmt.While statement, Scope scope) {
            super(statement.body(), scope, statement.body().size());
            this.statement = statement;
        }

        @Override
        @Nullable Stmt next() {
            while (true) {
                if (index < body.size()) {
                    return body.get(index++);
                }
                if (!expressions.condition(statement.condition(), scope, "WHILE")) {
                    return null;
                }
                state.tick(statement.line());
                index = 0;
            }
        }
    }

    private final class RepeatFrame extends Frame {
        private final Stmt.Repeat statement;

        RepeatFrame(Stmt.Repeat statement, Scope scope) {
            super(statement.body(), scope, 0);
            this.statement = statement;
            state.tick(statement.line());
        }

        @Override
        @Nullable Stmt next() {
            while (true) {
                if (index < body.size()) {
                    return body.get(index++);
                }
                if (expressions.condition(statement.condition(), scope, "UNTIL")) {
                    return null;
                }
                state.tick(statement.line());
                index = 0;
            }
        }
    }

    private final class ForFrame extends Frame {
        private final Stmt.For statement;
        private final StatementSupport.ForLoop loop;
        private boolean first = true;

        ForFrame(Stmt.For statement, StatementSupport.ForLoop loop, Scope scope) {
            super(statement.body(), scope, statement.body().size());
            this.statement = statement;
            this.loop = loop;
        }

        @Override
        @Nullable Stmt next() {
            while (true) {
                if (index < body.size()) {
                    return body.get(index++);
                }
                if (!first) {
                    loop.advance();
                }
                first = false;
                if (!loop.inRange()) {
                    return null;
                }
                state.tick(statement.line());
                index = 0;
            }
        }
    }

    // ========== Driving ==========

    /**
     * Run until the next signal.
     *
     * @throws ProgramException     on a run-time error, and again on every later call
     * @throws IllegalStateException if input, file content or a step is pending
     */
    public ExecutionSignal resume() {
        switch (sessionState) {
            case AWAITING_INPUT -> throw new IllegalStateException("Session is waiting for input");
            case AWAITING_FILE -> throw new IllegalStateException("Session is waiting for file content");
            case AWAITING_STEP -> throw new IllegalStateException("Session is waiting for a debug step");
            case FINISHED -> {
                return new ExecutionSignal.Finished(false);
            }
            case CANCELLED -> {
                return new ExecutionSignal.Finished(true);
            }
            case FAILED -> throw failure;
            default -> {
                // RUNNING
            }
        }

        if (pendingLine != null) {
            String line = pendingLine;
            pendingLine = null;
            return new ExecutionSignal.Output(line);
        }

        try {
            if (!started) {
                begin();
            }
            while (true) {
                Frame frame = frames.peek();
                if (frame == null) {
                    return finish();
                }

                Stmt stmt;
                if (held != null) {
                    stmt = held;
                    held = null;
                } else {
                    stmt = frame.next();
                    if (stmt == null) {
                        frames.pop();
                        frame.onExit();
                        continue;
                    }
                    if (debugMode && !isSkippedDefinition(stmt, frame)) {
                        held = stmt;
                        state.markLine(stmt.line());
                        sessionState = SessionState.AWAITING_STEP;
                        return new ExecutionSignal.StepRequired(stmt.line());
                    }
                }

                ExecutionSignal signal = dispatch(stmt, frame);
                if (signal != null) {
                    return signal;
                }
            }
        } catch (ProgramException e) {
            throw failWith(e);
        }
    }

    private void begin() {
        started = true;
        startedAt = System.currentTimeMillis();
        log.info("Starting program: {} statements, debug={}", program.statements().size(), debugMode);
        support.registerDefinitions(program);
        frames.push(new BlockFrame(program.statements(), state.global, true));
    }

    private ExecutionSignal finish() {
        sessionState = SessionState.FINISHED;
        finishedAt = System.currentTimeMillis();
        log.info("Program finished: {} output lines, {} iterations, {} trace entries",
                outputLog.size(), state.getIterations(), state.tracer.size());
        return new ExecutionSignal.Finished(false);
    }

    private static boolean isSkippedDefinition(Stmt stmt, Frame frame) {
        return StatementSupport.isDefinition(stmt) && frame instanceof BlockFrame block && block.topLevel;
    }

    private @Nullable ExecutionSignal dispatch(Stmt stmt, Frame frame) {
        Scope scope = frame.scope;
        if (isSkippedDefinition(stmt, frame)) {
            return null;
        }
        state.tick(stmt.line());

        if (stmt instanceof Stmt.Declare declare) {
            support.declare(declare, scope);
        } else if (stmt instanceof Stmt.Constant constant) {
            support.constant(constant, scope);
        } else if (stmt instanceof Stmt.Assign assign) {
            support.assign(assign, scope);
        } else if (stmt instanceof Stmt.Output output) {
            StringJoiner line = new StringJoiner(" ");
            for (Expr value : output.values()) {
                line.add(expressions.evaluate(value, scope).display());
            }
            return emit(line.toString());
        } else if (stmt instanceof Stmt.Input input) {
            Location location = support.resolveTarget(input.target(), scope);
            pendingInput = new PendingInput(location, input.line());
            sessionState = SessionState.AWAITING_INPUT;
            return new ExecutionSignal.InputRequired(location.label(),
                    location.variable().slotType().name(), input.line());
        } else if (stmt instanceof Stmt.If ifStmt) {
            List<Stmt> branch = support.selectBranch(ifStmt, scope);
            if (branch != null) {
                frames.push(new BlockFrame(branch, scope, false));
            }
        } else if (stmt instanceof Stmt.While whileStmt) {
            frames.push(new WhileFrame(whileStmt, scope));
        } else if (stmt instanceof Stmt.Repeat repeat) {
            frames.push(new RepeatFrame(repeat, scope));
        } else if (stmt instanceof Stmt.For forStmt) {
            frames.push(new ForFrame(forStmt, support.startFor(forStmt, scope), scope));
        } else if (stmt instanceof Stmt.Case caseStmt) {
            List<Stmt> branch = support.selectCase(caseStmt, scope);
            if (branch != null) {
                frames.push(new BlockFrame(branch, scope, false));
            }
        } else if (stmt instanceof Stmt.Call call) {
            callProcedure(call, scope);
        } else if (stmt instanceof Stmt.Return) {
            throw new ProgramException("RETURN is only allowed inside a function", stmt.line());
        } else if (stmt instanceof Stmt.OpenFile open) {
            String name = fileName(open.file(), scope);
            if (open.mode() == FileMode.READ) {
                pendingFile = new PendingFile(name, open.line());
                sessionState = SessionState.AWAITING_FILE;
                return new ExecutionSignal.FileContentRequired(name, open.line());
            }
            return emit(state.files.open(name, open.mode(), null, open.line()));
        } else if (stmt instanceof Stmt.CloseFile close) {
            return emit(state.files.close(fileName(close.file(), scope), close.line()));
        } else if (stmt instanceof Stmt.ReadFile read) {
            String name = fileName(read.file(), scope);
            Location location = support.resolveTarget(read.target(), scope);
            support.assignText(location, state.files.readLine(name, read.line()), read.line());
        } else if (stmt instanceof Stmt.WriteFile write) {
            String name = fileName(write.file(), scope);
            String data = expressions.evaluate(write.value(), scope).display();
            state.files.writeLine(name, data, write.line());
            if (echoFileWrites) {
                return emit("[Write to " + name + "] " + data);
            }
        } else if (stmt instanceof Stmt.Free free) {
            support.free(free, scope);
        } else if (StatementSupport.isDefinition(stmt)) {
            throw StatementSupport.nestedDefinition(stmt);
        } else {
            throw new IllegalStateException("Unhandled statement: " + stmt.getClass().getSimpleName());
        }
        return null;
    }

    private void callProcedure(Stmt.Call call, Scope scope) {
        Stmt.Procedure procedure = state.procedures.get(call.name());
        if (procedure == null) {
            throw new ProgramException(state.functions.containsKey(call.name())
                    ? "'" + call.name() + "' is a function; use it in an expression"
                    : "Procedure '" + call.name() + "' not defined", call.line());
        }
        Scope callee = support.enterCall(procedure.name(), CallKind.PROCEDURE, procedure.parameters(),
                call.arguments(), scope, call.line());
        frames.push(new ProcedureFrame(procedure, callee, call.line()));
    }

    private String fileName(Expr expr, Scope scope) {
        Value value = expressions.evaluate(expr, scope);
        return value.display();
    }

    private ExecutionSignal.Output emit(String line) {
        record(line);
        return new ExecutionSignal.Output(line);
    }

    private void record(String line) {
        outputLog.add(line);
        state.listener.onOutput(line);
    }

    // ========== Answering suspensions ==========

    /**
     * Answer an {@link ExecutionSignal.InputRequired}. The text is converted to the target's type
     * and echoed as the next output line.
     */
    public void provideInput(String text) {
        if (sessionState != SessionState.AWAITING_INPUT || pendingInput == null) {
            throw new IllegalStateException("No input is pending (state " + sessionState + ")");
        }
        PendingInput pending = pendingInput;
        pendingInput = null;
        sessionState = SessionState.RUNNING;
        try {
            support.assignText(pending.location(), text, pending.line());
        } catch (ProgramException e) {
            throw failWith(e);
        }
        record(text);
        pendingLine = text;
    }

    /**
     * Answer an {@link ExecutionSignal.FileContentRequired}.
     */
    public void provideFileContent(String content) {
        if (sessionState != SessionState.AWAITING_FILE || pendingFile == null) {
            throw new IllegalStateException("No file content is pending (state " + sessionState + ")");
        }
        PendingFile pending = pendingFile;
        pendingFile = null;
        sessionState = SessionState.RUNNING;
        String message;
        try {
            message = state.files.open(pending.name(), FileMode.READ, content, pending.line());
        } catch (ProgramException e) {
            throw failWith(e);
        }
        record(message);
        pendingLine = message;
    }

    /**
     * Let the paused statement run.
     */
    public void step() {
        if (sessionState != SessionState.AWAITING_STEP) {
            throw new IllegalStateException("Session is not paused (state " + sessionState + ")");
        }
        sessionState = SessionState.RUNNING;
    }

    /**
     * Stop the run. Later {@link #resume()} calls report {@code Finished(cancelled=true)}.
     * Does nothing once the session has ended.
     */
    public void cancel() {
        if (sessionState.isTerminal()) {
            return;
        }
        sessionState = SessionState.CANCELLED;
        held = null;
        pendingLine = null;
        pendingInput = null;
        pendingFile = null;
        frames.clear();
        finishedAt = System.currentTimeMillis();
        log.info("Program cancelled at line {}", state.currentLine());
    }

    /**
     * Fail the run with an error raised outside the interpreter, such as a failing handler.
     */
    ProgramException fail(String detail, @Nullable Throwable cause) {
        ProgramException error = cause != null
                ? new ProgramException(detail, state.currentLine(), cause)
                : new ProgramException(detail, state.currentLine());
        return failWith(error);
    }

    private ProgramException failWith(ProgramException e) {
        ProgramException error = e.withLine(state.currentLine());
        failureStack = state.callStack();
        failure = error;
        sessionState = SessionState.FAILED;
        held = null;
        frames.clear();
        state.unwindCalls();
        finishedAt = System.currentTimeMillis();
        log.warn("Program failed: {}", error.getMessage());
        state.listener.onFailure(error);
        return error;
    }

    // ========== Introspection ==========

    /**
     * Line, call stack and visible variables while paused before a statement.
     *
     * @throws IllegalStateException unless the session is at a step boundary
     */
    public DebugSnapshot debugSnapshot() {
        if (sessionState != SessionState.AWAITING_STEP) {
            throw new IllegalStateException("Debug snapshot is only available while paused at a step");
        }
        return state.snapshot(true);
    }

    public SessionState getState() {
        return sessionState;
    }

    public MemoryView getMemory() {
        return state.arena;
    }

    public TraceLog getTrace() {
        return state.tracer;
    }

    public FileSystem getFiles() {
        return state.files;
    }

    /**
     * Current call stack, outermost first. After a failure, the stack as it was when the error was raised.
     */
    public List<CallStackFrame> getCallStack() {
        return failureStack != null ? failureStack : state.callStack();
    }

    public List<String> getOutputLog() {
        return Collections.unmodifiableList(outputLog);
    }

    public @Nullable ProgramException getFailure() {
        return failure;
    }

    public long getRandomSeed() {
        return state.rng.getInitialSeed();
    }

    public ExecutionStats getStats() {
        long end = finishedAt > 0 ? finishedAt : System.currentTimeMillis();
        long elapsed = startedAt > 0 ? end - startedAt : 0;
        return state.stats(outputLog.size(), elapsed);
    }
}
