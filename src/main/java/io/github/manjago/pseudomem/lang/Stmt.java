package io.github.manjago.pseudomem.lang;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Statement nodes. Every node carries the source line it came from.
 */
public sealed interface Stmt {

    int line();

    /**
     * One declared name. {@code dimensions} and {@code elementType} are set for arrays only.
     */
    record Declare(String name, DataType type, List<ArrayBounds> dimensions,
                   @Nullable DataType elementType, int line) implements Stmt {
        public Declare {
            dimensions = List.copyOf(dimensions);
        }

        public boolean isArray() {
            return type == DataType.ARRAY;
        }
    }

    /** {@code CONSTANT name = literal} */
    record Constant(String name, Expr value, int line) implements Stmt {}

    /** Target is an Identifier, ArrayAccess or Dereference. */
    record Assign(Expr target, Expr value, int line) implements Stmt {}

    record Output(List<Expr> values, int line) implements Stmt {
        public Output {
            values = List.copyOf(values);
        }
    }

    /** Target is an Identifier or ArrayAccess. */
    record Input(Expr target, int line) implements Stmt {}

    record If(Expr condition, List<Stmt> thenBranch, List<ElseIf> elseIfs,
              @Nullable List<Stmt> elseBranch, int line) implements Stmt {}

    record ElseIf(Expr condition, List<Stmt> body) {}

    record While(Expr condition, List<Stmt> body, int line) implements Stmt {}

    record Repeat(List<Stmt> body, Expr condition, int line) implements Stmt {}

    record For(String variable, Expr start, Expr end, @Nullable Expr step,
               List<Stmt> body, int line) implements Stmt {}

    record Case(Expr subject, List<CaseBranch> branches, @Nullable List<Stmt> otherwise,
                int line) implements Stmt {}

    /** {@code value : body} or {@code value TO rangeEnd : body} */
    record CaseBranch(Expr value, @Nullable Expr rangeEnd, List<Stmt> body) {
        public boolean isRange() {
            return rangeEnd != null;
        }
    }

    record Procedure(String name, List<Parameter> parameters, List<Stmt> body,
                     int line) implements Stmt {}

    record Function(String name, List<Parameter> parameters, DataType returnType,
                    List<Stmt> body, int line) implements Stmt {}

    record Call(String name, List<Expr> arguments, int line) implements Stmt {}

    record Return(Expr value, int line) implements Stmt {}

    record OpenFile(Expr file, FileMode mode, int line) implements Stmt {}

    record CloseFile(Expr file, int line) implements Stmt {}

    /** Target is an Identifier or ArrayAccess. */
    record ReadFile(Expr file, Expr target, int line) implements Stmt {}

    record WriteFile(Expr file, Expr value, int line) implements Stmt {}

    record Free(Expr pointer, int line) implements Stmt {}
}
