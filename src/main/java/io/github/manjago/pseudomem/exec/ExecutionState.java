package io.github.manjago.pseudomem.exec;

import io.github.manjago.pseudomem.config.InterpreterConfig;
import io.github.manjago.pseudomem.core.Allocation;
import io.github.manjago.pseudomem.core.MemoryArena;
import io.github.manjago.pseudomem.core.MemoryFault;
import io.github.manjago.pseudomem.core.MemoryFaultException;
import io.github.manjago.pseudomem.core.ProgramException;
import io.github.manjago.pseudomem.core.Value;
import io.github.manjago.pseudomem.lang.ArrayBounds;
import io.github.manjago.pseudomem.lang.DataType;
import io.github.manjago.pseudomem.lang.Stmt;
import io.github.manjago.pseudomem.trace.OperationTracer;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of one run, shared by the suspendable and synchronous paths.
 *
 * <p>Owns the arena, tracer, files, global scope, call stack and budgets. Every
 * variable write goes through {@link #write} so the variable, its arena slot and
 * the trace stay in step; pointer writes resolve back to the owning variable
 * through the slot map.
 */
final class ExecutionState {

    private static final Logger log = LoggerFactory.getLogger(ExecutionState.class);

    static final String MAIN = "main";

    final InterpreterConfig config;
    final MemoryArena arena;
    final OperationTracer tracer;
    final FileSystem files = new FileSystem();
    final ProgramRng rng;
    final Builtins builtins;
    final Scope global = new Scope(MAIN, null);
    final Map<String, Stmt.Procedure> procedures = new LinkedHashMap<>();
    final Map<String, Stmt.Function> functions = new LinkedHashMap<>();

    ExecutionListener listener = ExecutionListener.NOOP;

    private final Deque<ActiveCall> calls = new ArrayDeque<>();
    private final Map<Integer, Slot> slots = new HashMap<>();

    private long iterations = 0;
    private int recursionDepth = 0;
    private int totalCalls = 0;
    private int maxCallDepth = 0;

    /** Variable storage cell behind an arena address */
    private record Slot(Variable variable, int index) {}

    /** Live call-stack entry */
    static final class ActiveCall {
        final String name;
        final CallKind kind;
        final Scope scope;
        int line;

        ActiveCall(String name, CallKind kind, Scope scope, int line) {
            this.name = name;
            this.kind = kind;
            this.scope = scope;
            this.line = line;
        }

        CallStackFrame toFrame() {
            return new CallStackFrame(name, kind, line);
        }
    }

    ExecutionState(InterpreterConfig config, MemoryArena arena, OperationTracer tracer) {
        this.config = config;
        this.arena = arena;
        this.tracer = tracer;
        this.rng = new ProgramRng(config.effectiveSeed());
        this.builtins = new Builtins(rng, files);
        this.calls.push(new ActiveCall(MAIN, CallKind.MAIN, global, 1));
        log.debug("Execution state created (RANDOM seed: {})", rng.getInitialSeed());
    }

    // ========== Budgets and call stack ==========

    /**
     * Count one statement dispatch or loop iteration against the budget.
     */
    void tick(int line) {
        calls.peek().line = line;
        if (++iterations > config.maxIterations()) {
            throw new ProgramException("Execution timeout: possible infinite loop (more than "
                    + config.maxIterations() + " iterations)", line);
        }
    }

    /**
     * Move the current frame to {@code line} without counting it.
     */
    void markLine(int line) {
        calls.peek().line = line;
    }

    /**
     * Push a frame for a procedure or function and return its fresh scope.
     */
    Scope enterCall(String name, CallKind kind, int line) {
        if (++recursionDepth > config.maxRecursionDepth()) {
            throw new ProgramException("Maximum recursion depth exceeded (" + config.maxRecursionDepth()
                    + ") calling '" + name + "'", line);
        }
        Scope scope = new Scope(name, global);
        ActiveCall call = new ActiveCall(name, kind, scope, line);
        calls.push(call);
        totalCalls++;
        maxCallDepth = Math.max(maxCallDepth, recursionDepth);
        log.trace("Enter {} '{}' (depth {})", kind, name, recursionDepth);
        listener.onCallEnter(call.toFrame(), recursionDepth);
        return scope;
    }

    void exitCall() {
        ActiveCall call = calls.pop();
        recursionDepth--;
        listener.onCallExit(call.toFrame(), recursionDepth);
    }

    /**
     * Drop every frame above main after a failure. Memory is left as it was.
     */
    void unwindCalls() {
        while (calls.size() > 1) {
            calls.pop();
        }
        recursionDepth = 0;
    }

    int currentLine() {
        return calls.peek().line;
    }

    Scope currentScope() {
        return calls.peek().scope;
    }

    /**
     * Frames outermost first.
     */
    List<CallStackFrame> callStack() {
        List<CallStackFrame> frames = new ArrayList<>(calls.size());
        for (Iterator<ActiveCall> it = calls.descendingIterator(); it.hasNext(); ) {
            frames.add(it.next().toFrame());
        }
        return frames;
    }

    long getIterations() {
        return iterations;
    }

    int getTotalCalls() {
        return totalCalls;
    }

    int getMaxCallDepth() {
        return maxCallDepth;
    }

    // ========== Declarations ==========

    Variable declare(Scope scope, Stmt.Declare declaration) {
        String name = declaration.name();
        int line = declaration.line();
        ensureUndeclared(scope, name, line);

        Variable variable;
        if (declaration.isArray()) {
            List<ArrayBounds> dimensions = declaration.dimensions();
            int count;
            try {
                count = Variable.cellCount(dimensions);
            } catch (ArithmeticException e) {
                throw new ProgramException("Array '" + name + "' is too large", line, e);
            }
            int address = allocate(count, "ARRAY OF " + declaration.elementType(), line);
            variable = Variable.array(name, declaration.elementType(), dimensions, address);
        } else {
            variable = Variable.scalar(name, declaration.type(), allocate(1, declaration.type().name(), line));
        }
        register(scope, variable, line);
        return variable;
    }

    Variable declareScalar(Scope scope, String name, DataType type, int line) {
        ensureUndeclared(scope, name, line);
        Variable variable = Variable.scalar(name, type, allocate(1, type.name(), line));
        register(scope, variable, line);
        return variable;
    }

    Variable declareConstant(Scope scope, String name, Value value, int line) {
        ensureUndeclared(scope, name, line);
        DataType type = inferType(value);
        Variable variable = Variable.constant(name, type, allocate(1, type.name(), line));
        register(scope, variable, line);
        store(variable, -1, name, value, line);
        return variable;
    }

    /**
     * New array in {@code scope} holding a copy of {@code source}'s elements (BYVAL array argument).
     */
    Variable declareArrayCopy(Scope scope, String name, Variable source, int line) {
        ensureUndeclared(scope, name, line);
        int address = allocate(source.getCellCount(), "ARRAY OF " + source.getElementType(), line);
        Variable copy = Variable.array(name, source.getElementType(), source.getDimensions(), address);
        register(scope, copy, line);
        for (int i = 0; i < source.getCellCount(); i++) {
            Value value = source.get(i);
            if (value != null) {
                store(copy, i, copy.elementLabel(i), value, line);
            }
        }
        return copy;
    }

    private void register(Scope scope, Variable variable, int line) {
        scope.declare(variable);
        for (int i = 0; i < variable.getCellCount(); i++) {
            slots.put(variable.getAddress() + i, new Slot(variable, variable.isArray() ? i : -1));
        }
        tracer.logDeclare(line, variable.getName(), variable.getAddress(), variable.typeName());
    }

    private static void ensureUndeclared(Scope scope, String name, int line) {
        if (scope.isDeclaredHere(name)) {
            throw new ProgramException("Variable '" + name + "' already declared", line);
        }
    }

    private static DataType inferType(Value value) {
        if (value instanceof Value.Num num) {
            return num.isIntegral() ? DataType.INTEGER : DataType.REAL;
        }
        if (value instanceof Value.Text) {
            return DataType.STRING;
        }
        if (value instanceof Value.Bool) {
            return DataType.BOOLEAN;
        }
        return DataType.VOID_POINTER;
    }

    // ========== Variable access ==========

    Value read(Location location, int line) {
        Variable variable = location.variable();
        checkLive(variable, line);
        Value value = variable.get(location.index());
        if (value == null) {
            throw new ProgramException(location.index() < 0
                    ? "Variable '" + location.label() + "' used before assignment"
                    : "Array element " + location.label() + " accessed before assignment", line);
        }
        tracer.logRead(line, location.label(), location.address(), value);
        return value;
    }

    void write(Location location, Value value, int line) {
        Variable variable = location.variable();
        if (variable.isConstant()) {
            throw new ProgramException("Cannot assign to constant '" + variable.getName() + "'", line);
        }
        store(variable, location.index(), location.label(), value, line);
    }

    private void store(Variable variable, int index, String label, Value value, int line) {
        checkLive(variable, line);
        Value coerced = coerce(variable.slotType(), value, label, line);
        Value old = variable.get(index);
        int address = variable.addressOf(index);
        try {
            arena.write(address, coerced);
        } catch (MemoryFaultException e) {
            throw e.withLine(line);
        }
        variable.set(index, coerced);

        if (coerced instanceof Value.Address target && variable.slotType().isPointer()) {
            tracer.logPointerAssign(line, label, address, target.value());
        } else {
            tracer.logWrite(line, label, address, coerced, old);
        }
    }

    private static void checkLive(Variable variable, int line) {
        if (variable.isReleased()) {
            throw new MemoryFaultException(MemoryFault.NOT_ALLOCATED, "Storage of '" + variable.getName()
                    + "' at address " + variable.getAddress() + " has been freed").withLine(line);
        }
    }

    /**
     * Check a value against a declared slot type. Whole numbers are accepted as addresses
     * for pointer types.
     */
    static Value coerce(DataType type, Value value, String label, int line) {
        Value conformed = conform(type, value);
        if (conformed == null) {
            throw new ProgramException("Type mismatch: cannot assign " + value.kindName() + " to "
                    + type + " '" + label + "'", line);
        }
        return conformed;
    }

    /**
     * The value as stored in a slot of the given type, or null if it does not fit.
     */
    static @Nullable Value conform(DataType type, Value value) {
        return switch (type) {
            case INTEGER, REAL -> value instanceof Value.Num ? value : null;
            case STRING, CHAR -> value instanceof Value.Text ? value : null;
            case BOOLEAN -> value instanceof Value.Bool ? value : null;
            case POINTER_TO_INTEGER, POINTER_TO_REAL, POINTER_TO_CHAR, VOID_POINTER -> {
                if (value instanceof Value.Address) {
                    yield value;
                }
                if (value instanceof Value.Num num && num.isIntegral() && num.value() >= 0
                        && num.value() <= Integer.MAX_VALUE) {
                    yield Value.address((int) num.value());
                }
                yield null;
            }
            case ARRAY -> null;
        };
    }

    // ========== Pointers and heap ==========

    int addressOf(Location location, int line) {
        checkLive(location.variable(), line);
        int address = location.address();
        tracer.logAddressOf(line, location.label(), address);
        return address;
    }

    /**
     * {@code *p}: read the slot at an address.
     */
    Value readAt(int address, @Nullable String pointer, int line) {
        Value value;
        try {
            value = arena.read(address);
        } catch (MemoryFaultException e) {
            throw e.withLine(line);
        }
        if (value == null) {
            throw new ProgramException("Memory at address " + address + " read before assignment", line);
        }
        tracer.logDereference(line, pointer, address, value);
        return value;
    }

    /**
     * {@code *p ← v}: write the slot at an address, through its owning variable if it has one.
     */
    void writeAt(int address, Value value, @Nullable String pointer, int line) {
        Slot slot = slots.get(address);
        if (slot != null) {
            Variable variable = slot.variable();
            write(new Location(variable, slot.index(), variable.elementLabel(slot.index())), value, line);
            return;
        }
        Value old = arena.peek(address);
        try {
            arena.write(address, value);
        } catch (MemoryFaultException e) {
            throw e.withLine(line);
        }
        tracer.logWrite(line, pointer != null ? "*" + pointer : null, address, value, old);
    }

    int allocateHeap(int count, int line) {
        int address = allocate(count, "MALLOC", line);
        tracer.logAllocate(line, address, count, "MALLOC");
        return address;
    }

    /**
     * FREE: release the block starting at {@code address}. Variables stored there become unusable.
     */
    void freeHeap(int address, int line) {
        Allocation block;
        try {
            block = arena.free(address);
        } catch (MemoryFaultException e) {
            throw e.withLine(line);
        }
        for (int a = block.address(); a < block.end(); a++) {
            Slot slot = slots.remove(a);
            if (slot != null) {
                slot.variable().markReleased();
            }
        }
        tracer.logFree(line, address, block.size());
    }

    /**
     * Free the blocks of every variable a returning call owns.
     */
    void release(Scope scope, int line) {
        for (Variable variable : scope.ownedVariables()) {
            Slot slot = slots.get(variable.getAddress());
            if (variable.isReleased() || slot == null || slot.variable() != variable) {
                continue;
            }
            freeHeap(variable.getAddress(), line);
        }
    }

    private int allocate(int count, String type, int line) {
        try {
            return arena.allocate(count, type);
        } catch (MemoryFaultException e) {
            throw e.withLine(line);
        }
    }

    // ========== Introspection ==========

    DebugSnapshot snapshot(boolean paused) {
        Map<String, VariableSnapshot> variables = new LinkedHashMap<>();
        currentScope().visibleVariables().forEach((name, variable) ->
                variables.put(name, VariableSnapshot.of(name, variable)));
        return new DebugSnapshot(currentLine(), callStack(), variables, paused);
    }

    ExecutionStats stats(int outputLines, long elapsedMillis) {
        return new ExecutionStats(iterations, totalCalls, maxCallDepth, outputLines,
                tracer.size(), arena.getStats(), elapsedMillis);
    }
}
