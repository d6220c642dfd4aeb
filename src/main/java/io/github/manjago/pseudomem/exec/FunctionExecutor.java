package io.github.manjago.pseudomem.exec;

import io.github.manjago.pseudomem.core.ProgramException;
import io.github.manjago.pseudomem.core.Value;
import io.github.manjago.pseudomem.lang.Expr;
import io.github.manjago.pseudomem.lang.Stmt;

import java.util.List;

/**
 * Runs function bodies to completion on the Java stack.
 *
 * <p>There is no way to suspend from here: OUTPUT, INPUT, file statements and CALL
 * are rejected when a function body reaches them.
 */
final class FunctionExecutor {

    private final ExecutionState state;
    private final StatementSupport support;
    private final ExpressionEvaluator expressions;

    FunctionExecutor(ExecutionState state, StatementSupport support, ExpressionEvaluator expressions) {
        this.state = state;
        this.support = support;
        this.expressions = expressions;
    }

    /** RETURN unwinding the Java stack back to {@link #call}. */
    private static final class ReturnSignal extends RuntimeException {
        final Value value;

        ReturnSignal(Value value) {
            super(null, null, false, false);
            this.value = value;
        }
    }

    Value call(Stmt.Function function, List<Expr> arguments, Scope callerScope, int line) {
        state.tick(line);
        Scope scope = support.enterCall(function.name(), CallKind.FUNCTION, function.parameters(),
                arguments, callerScope, line);

        Value result;
        try {
            executeBlock(function.body(), scope, function);
            throw new ProgramException("Function '" + function.name() + "' did not return a value",
                    function.line());
        } catch (ReturnSignal signal) {
            result = signal.value;
        }

        Value conformed = ExecutionState.conform(function.returnType(), result);
        if (conformed == null) {
            throw new ProgramException("Function '" + function.name() + "' must return "
                    + function.returnType() + ", got " + result.kindName(), line);
        }
        support.exitCall(scope, line);
        return conformed;
    }

    private void executeBlock(List<Stmt> body, Scope scope, Stmt.Function function) {
        for (Stmt stmt : body) {
            execute(stmt, scope, function);
        }
    }

    private void execute(Stmt stmt, Scope scope, Stmt.Function function) {
        state.tick(stmt.line());

        if (stmt instanceof Stmt.Declare declare) {
            support.declare(declare, scope);
        } else if (stmt instanceof Stmt.Constant constant) {
            support.constant(constant, scope);
        } else if (stmt instanceof Stmt.Assign assign) {
            support.assign(assign, scope);
        } else if (stmt instanceof Stmt.If ifStmt) {
            List<Stmt> branch = support.selectBranch(ifStmt, scope);
            if (branch != null) {
                executeBlock(branch, scope, function);
            }
        } else if (stmt instanceof Stmt.While whileStmt) {
            while (expressions.condition(whileStmt.condition(), scope, "WHILE")) {
                state.tick(whileStmt.line());
                executeBlock(whileStmt.body(), scope, function);
            }
        } else if (stmt instanceof Stmt.Repeat repeat) {
            do {
                state.tick(repeat.line());
                executeBlock(repeat.body(), scope, function);
            } while (!expressions.condition(repeat.condition(), scope, "UNTIL"));
        } else if (stmt instanceof Stmt.For forStmt) {
            StatementSupport.ForLoop loop = support.startFor(forStmt, scope);
            while (loop.inRange()) {
                state.tick(forStmt.line());
                executeBlock(forStmt.body(), scope, function);
                loop.advance();
            }
        } else if (stmt instanceof Stmt.Case caseStmt) {
            List<Stmt> branch = support.selectCase(caseStmt, scope);
            if (branch != null) {
                executeBlock(branch, scope, function);
            }
        } else if (stmt instanceof Stmt.Return ret) {
            throw new ReturnSignal(expressions.evaluate(ret.value(), scope));
        } else if (stmt instanceof Stmt.Free free) {
            support.free(free, scope);
        } else if (StatementSupport.isDefinition(stmt)) {
            throw StatementSupport.nestedDefinition(stmt);
        } else {
            throw new ProgramException(StatementSupport.keyword(stmt) + " is not allowed inside function '"
                    + function.name() + "'", stmt.line());
        }
    }
}
