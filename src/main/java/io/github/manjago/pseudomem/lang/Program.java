package io.github.manjago.pseudomem.lang;

import java.util.List;

/**
 * Root of a parsed program. Immutable.
 */
public record Program(List<Stmt> statements) {

    public Program {
        statements = List.copyOf(statements);
    }

    public List<Stmt.Procedure> procedures() {
        return statements.stream()
                .filter(Stmt.Procedure.class::isInstance)
                .map(Stmt.Procedure.class::cast)
                .toList();
    }

    public List<Stmt.Function> functions() {
        return statements.stream()
                .filter(Stmt.Function.class::isInstance)
                .map(Stmt.Function.class::cast)
                .toList();
    }
}
