package io.github.manjago.pseudomem.exec;

import io.github.manjago.pseudomem.core.ProgramException;
import io.github.manjago.pseudomem.core.Value;
import io.github.manjago.pseudomem.lang.DataType;
import io.github.manjago.pseudomem.lang.Expr;
import io.github.manjago.pseudomem.lang.Parameter;
import io.github.manjago.pseudomem.lang.Program;
import io.github.manjago.pseudomem.lang.Stmt;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Statement semantics shared by the suspendable and synchronous paths.
 *
 * <p>Only non-suspending work lives here. Each path decides for itself what to do
 * with the branch, loop or scope these methods hand back.
 */
final class StatementSupport {

    private final ExecutionState state;
    private final ExpressionEvaluator expressions;

    StatementSupport(ExecutionState state, ExpressionEvaluator expressions) {
        this.state = state;
        this.expressions = expressions;
    }

    /**
     * Record top-level procedures and functions before anything runs.
     */
    void registerDefinitions(Program program) {
        for (Stmt.Procedure procedure : program.procedures()) {
            ensureNewName(procedure.name(), procedure.line());
            state.procedures.put(procedure.name(), procedure);
        }
        for (Stmt.Function function : program.functions()) {
            ensureNewName(function.name(), function.line());
            state.functions.put(function.name(), function);
        }
    }

    private void ensureNewName(String name, int line) {
        if (state.procedures.containsKey(name) || state.functions.containsKey(name)) {
            throw new ProgramException("'" + name + "' is already defined", line);
        }
    }

    static boolean isDefinition(Stmt stmt) {
        return stmt instanceof Stmt.Procedure || stmt instanceof Stmt.Function;
    }

    static String keyword(Stmt stmt) {
        if (stmt instanceof Stmt.Output) return "OUTPUT";
        if (stmt instanceof Stmt.Input) return "INPUT";
        if (stmt instanceof Stmt.OpenFile) return "OPENFILE";
        if (stmt instanceof Stmt.CloseFile) return "CLOSEFILE";
        if (stmt instanceof Stmt.ReadFile) return "READFILE";
        if (stmt instanceof Stmt.WriteFile) return "WRITEFILE";
        if (stmt instanceof Stmt.Call) return "CALL";
        if (stmt instanceof Stmt.Return) return "RETURN";
        return stmt.getClass().getSimpleName().toUpperCase();
    }

    static ProgramException nestedDefinition(Stmt stmt) {
        return new ProgramException("Procedures and functions can only be defined at the top level", stmt.line());
    }

    // ========== Simple statements ==========

    void declare(Stmt.Declare declaration, Scope scope) {
        state.declare(scope, declaration);
    }

    void constant(Stmt.Constant constant, Scope scope) {
        state.declareConstant(scope, constant.name(), expressions.evaluate(constant.value(), scope), constant.line());
    }

    void assign(Stmt.Assign assign, Scope scope) {
        Value value = expressions.evaluate(assign.value(), scope);
        if (assign.target() instanceof Expr.Dereference dereference) {
            int address = expressions.pointerValue(dereference.pointer(), scope);
            state.writeAt(address, value, ExpressionEvaluator.pointerName(dereference.pointer()), assign.line());
        } else {
            state.write(expressions.resolve(assign.target(), scope), value, assign.line());
        }
    }

    void free(Stmt.Free free, Scope scope) {
        state.freeHeap(expressions.pointerValue(free.pointer(), scope), free.line());
    }

    // ========== Branching ==========

    /**
     * The IF branch to run, or null when none applies.
     */
    @Nullable List<Stmt> selectBranch(Stmt.If statement, Scope scope) {
        if (expressions.condition(statement.condition(), scope, "IF")) {
            return statement.thenBranch();
        }
        for (Stmt.ElseIf elseIf : statement.elseIfs()) {
            if (expressions.condition(elseIf.condition(), scope, "ELSE IF")) {
                return elseIf.body();
            }
        }
        return statement.elseBranch();
    }

    /**
     * The first matching CASE branch, OTHERWISE, or null.
     */
    @Nullable List<Stmt> selectCase(Stmt.Case statement, Scope scope) {
        Value subject = expressions.evaluate(statement.subject(), scope);
        for (Stmt.CaseBranch branch : statement.branches()) {
            Value value = expressions.evaluate(branch.value(), scope);
            if (branch.isRange()) {
                double low = Conversions.numericCoercion(value);
                double high = Conversions.numericCoercion(expressions.evaluate(branch.rangeEnd(), scope));
                double actual = Conversions.numericCoercion(subject);
                if (actual >= low && actual <= high) {
                    return branch.body();
                }
            } else if (Operators.strictEquals(subject, value)) {
                return branch.body();
            }
        }
        return statement.otherwise();
    }

    // ========== Loops ==========

    /**
     * Evaluate a FOR header once and set the loop variable to floor(start).
     */
    ForLoop startFor(Stmt.For statement, Scope scope) {
        int line = statement.line();
        Variable variable = scope.lookup(statement.variable());
        if (variable == null) {
            variable = state.declareScalar(scope, statement.variable(), DataType.INTEGER, line);
        }
        if (variable.isArray() || !variable.getType().isNumeric()) {
            throw new ProgramException("FOR loop variable '" + statement.variable()
                    + "' must be INTEGER or REAL", line);
        }

        double start = loopBound(statement.start(), scope, line);
        double end = loopBound(statement.end(), scope, line);
        double step = statement.step() != null ? loopBound(statement.step(), scope, line) : 1;
        if (step == 0) {
            throw new ProgramException("FOR loop STEP cannot be zero", line);
        }

        Location location = new Location(variable, -1, statement.variable());
        state.write(location, Value.of(Math.floor(start)), line);
        return new ForLoop(location, end, step, line);
    }

    private double loopBound(Expr expr, Scope scope, int line) {
        Value value = expressions.evaluate(expr, scope);
        if (!(value instanceof Value.Num num)) {
            throw new ProgramException("FOR loop start, end and step must be numbers", line);
        }
        return num.value();
    }

    /**
     * Running FOR loop. The increment is floor(step), recomputed from the original step each time.
     */
    final class ForLoop {
        private final Location location;
        private final double end;
        private final double step;
        private final int line;

        private ForLoop(Location location, double end, double step, int line) {
            this.location = location;
            this.end = end;
            this.step = step;
            this.line = line;
        }

        boolean inRange() {
            double current = current();
            return step > 0 ? current <= end : current >= end;
        }

        void advance() {
            state.write(location, Value.of(current() + Math.floor(step)), line);
        }

        private double current() {
            return ((Value.Num) state.read(location, line)).value();
        }
    }

    // ========== INPUT / READFILE ==========

    Location resolveTarget(Expr target, Scope scope) {
        return expressions.resolve(target, scope);
    }

    void assignText(Location location, String text, int line) {
        state.write(location, Conversions.fromInput(text, location.variable().slotType()), line);
    }

    // ========== Calls ==========

    /**
     * Check and evaluate arguments in the caller's scope, push the call, and bind
     * parameters in the callee's fresh scope.
     */
    Scope enterCall(String name, CallKind kind, List<Parameter> parameters, List<Expr> arguments,
                    Scope caller, int line) {
        if (arguments.size() != parameters.size()) {
            throw new ProgramException("Incorrect number of arguments for " + kind.name().toLowerCase()
                    + " '" + name + "': expected " + parameters.size() + ", got " + arguments.size(), line);
        }

        List<Object> bound = new ArrayList<>(parameters.size());
        for (int i = 0; i < parameters.size(); i++) {
            Parameter parameter = parameters.get(i);
            Expr argument = arguments.get(i);
            if (parameter.byRef() || parameter.type() == DataType.ARRAY) {
                bound.add(variableArgument(name, parameter, argument, caller));
            } else {
                bound.add(expressions.evaluate(argument, caller));
            }
        }

        Scope scope = state.enterCall(name, kind, line);
        for (int i = 0; i < parameters.size(); i++) {
            Parameter parameter = parameters.get(i);
            Object argument = bound.get(i);
            if (parameter.byRef()) {
                scope.alias(parameter.name(), (Variable) argument);
            } else if (parameter.type() == DataType.ARRAY) {
                state.declareArrayCopy(scope, parameter.name(), (Variable) argument, line);
            } else {
                Variable variable = state.declareScalar(scope, parameter.name(), parameter.type(), line);
                state.write(new Location(variable, -1, parameter.name()), (Value) argument, line);
            }
        }
        return scope;
    }

    private Variable variableArgument(String callee, Parameter parameter, Expr argument, Scope caller) {
        if (!(argument instanceof Expr.Identifier identifier)) {
            throw new ProgramException("Argument for " + (parameter.byRef() ? "BYREF " : "array ")
                    + "parameter '" + parameter.name() + "' of '" + callee + "' must be a variable name",
                    argument.line());
        }
        Variable variable = expressions.lookup(identifier.name(), caller, identifier.line());
        if (variable.isArray() != (parameter.type() == DataType.ARRAY)) {
            throw new ProgramException("Argument '" + identifier.name() + "' does not match parameter '"
                    + parameter.name() + " : " + parameter.type() + "' of '" + callee + "'", argument.line());
        }
        return variable;
    }

    /**
     * Release the callee's variables and pop its frame after a normal return.
     */
    void exitCall(Scope scope, int line) {
        state.release(scope, line);
        state.exitCall();
    }
}
