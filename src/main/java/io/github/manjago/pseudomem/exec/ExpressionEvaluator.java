package io.github.manjago.pseudomem.exec;

import io.github.manjago.pseudomem.core.MemoryArena;
import io.github.manjago.pseudomem.core.ProgramException;
import io.github.manjago.pseudomem.core.Value;
import io.github.manjago.pseudomem.lang.Expr;
import io.github.manjago.pseudomem.lang.Stmt;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates expressions. Never suspends: user function calls run to completion
 * on the synchronous path.
 */
final class ExpressionEvaluator {

    private final ExecutionState state;
    private FunctionExecutor functions;

    ExpressionEvaluator(ExecutionState state) {
        this.state = state;
    }

    void bindFunctions(FunctionExecutor functions) {
        this.functions = functions;
    }

    Value evaluate(Expr expr, Scope scope) {
        if (expr instanceof Expr.NumberLiteral literal) {
            return Value.of(literal.value());
        }
        if (expr instanceof Expr.StringLiteral literal) {
            return Value.of(literal.value());
        }
        if (expr instanceof Expr.BooleanLiteral literal) {
            return Value.of(literal.value());
        }
        if (expr instanceof Expr.Identifier || expr instanceof Expr.ArrayAccess) {
            return state.read(resolve(expr, scope), expr.line());
        }
        if (expr instanceof Expr.Binary binary) {
            Value left = evaluate(binary.left(), scope);
            Value right = evaluate(binary.right(), scope);
            return Operators.binary(binary.operator(), left, right, binary.line());
        }
        if (expr instanceof Expr.Unary unary) {
            return Operators.unary(unary.operator(), evaluate(unary.operand(), scope), unary.line());
        }
        if (expr instanceof Expr.FunctionCall call) {
            return callFunction(call, scope);
        }
        if (expr instanceof Expr.AddressOf addressOf) {
            return Value.address(state.addressOf(resolve(addressOf.target(), scope), addressOf.line()));
        }
        if (expr instanceof Expr.Dereference dereference) {
            int address = pointerValue(dereference.pointer(), scope);
            return state.readAt(address, pointerName(dereference.pointer()), dereference.line());
        }
        if (expr instanceof Expr.Allocation allocation) {
            Value size = evaluate(allocation.size(), scope);
            if (!(size instanceof Value.Num num) || !num.isIntegral()) {
                throw new ProgramException("MALLOC size must be a whole number, got " + size.display(),
                        allocation.line());
            }
            return Value.address(state.allocateHeap((int) num.value(), allocation.line()));
        }
        if (expr instanceof Expr.SizeOf sizeOf) {
            return Value.of(MemoryArena.typeSize(sizeOf.type().name()));
        }
        throw new IllegalStateException("Unhandled expression: " + expr.getClass().getSimpleName());
    }

    /**
     * Evaluate a condition that must be boolean.
     */
    boolean condition(Expr expr, Scope scope, String construct) {
        Value value = evaluate(expr, scope);
        if (!(value instanceof Value.Bool bool)) {
            throw new ProgramException(construct + " condition must be a boolean, got " + value.kindName(),
                    expr.line());
        }
        return bool.value();
    }

    /**
     * Resolve an identifier or array element to its storage.
     */
    Location resolve(Expr target, Scope scope) {
        if (target instanceof Expr.Identifier identifier) {
            Variable variable = lookup(identifier.name(), scope, identifier.line());
            if (variable.isArray()) {
                throw new ProgramException("Array '" + identifier.name()
                        + "' must be indexed", identifier.line());
            }
            return new Location(variable, -1, identifier.name());
        }
        if (target instanceof Expr.ArrayAccess access) {
            Variable variable = lookup(access.name(), scope, access.line());
            if (!variable.isArray()) {
                throw new ProgramException("'" + access.name() + "' is not an array", access.line());
            }
            if (access.indices().size() != variable.getDimensions().size()) {
                throw new ProgramException("Array '" + access.name() + "' expects "
                        + variable.getDimensions().size() + " indices, got " + access.indices().size(),
                        access.line());
            }
            List<Integer> subscripts = new ArrayList<>();
            for (Expr index : access.indices()) {
                Value value = evaluate(index, scope);
                if (!(value instanceof Value.Num num)) {
                    throw new ProgramException("Array index must be a number", access.line());
                }
                subscripts.add((int) Math.floor(num.value()));
            }
            int flat = variable.flatIndex(subscripts);
            if (flat < 0) {
                throw new ProgramException("Array index out of bounds: " + access.name() + subscripts
                        + " (bounds " + variable.getDimensions() + ")", access.line());
            }
            return new Location(variable, flat, variable.elementLabel(flat));
        }
        throw new ProgramException("Invalid assignment target", target.line());
    }

    Variable lookup(String name, Scope scope, int line) {
        Variable variable = scope.lookup(name);
        if (variable == null) {
            throw new ProgramException("Variable '" + name + "' not declared", line);
        }
        return variable;
    }

    /**
     * Evaluate an expression used as a pointer.
     */
    int pointerValue(Expr pointer, Scope scope) {
        Value value = evaluate(pointer, scope);
        if (value instanceof Value.Address address) {
            return address.value();
        }
        if (value instanceof Value.Num num && num.isIntegral()) {
            return (int) num.value();
        }
        throw new ProgramException("Cannot dereference a " + value.kindName(), pointer.line());
    }

    static @Nullable String pointerName(Expr pointer) {
        return pointer instanceof Expr.Identifier identifier ? identifier.name() : null;
    }

    private Value callFunction(Expr.FunctionCall call, Scope scope) {
        String name = call.name();
        if (Builtins.isBuiltin(name)) {
            List<Value> args = new ArrayList<>(call.arguments().size());
            for (Expr argument : call.arguments()) {
                args.add(evaluate(argument, scope));
            }
            return state.builtins.call(name, args, call.line());
        }
        Stmt.Function function = state.functions.get(name);
        if (function == null) {
            if (state.procedures.containsKey(name)) {
                throw new ProgramException("'" + name + "' is a procedure; use CALL", call.line());
            }
            throw new ProgramException("Function '" + name + "' not defined", call.line());
        }
        return functions.call(function, call.arguments(), scope, call.line());
    }
}
