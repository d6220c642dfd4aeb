package io.github.manjago.pseudomem.lang;

import java.util.List;

/**
 * Expression nodes. Every node carries the source line it came from.
 */
public sealed interface Expr {

    int line();

    record NumberLiteral(double value, int line) implements Expr {}

    record StringLiteral(String value, int line) implements Expr {}

    record BooleanLiteral(boolean value, int line) implements Expr {}

    record Identifier(String name, int line) implements Expr {}

    record ArrayAccess(String name, List<Expr> indices, int line) implements Expr {
        public ArrayAccess {
            indices = List.copyOf(indices);
        }
    }

    record Binary(BinaryOperator operator, Expr left, Expr right, int line) implements Expr {}

    record Unary(UnaryOperator operator, Expr operand, int line) implements Expr {}

    record FunctionCall(String name, List<Expr> arguments, int line) implements Expr {
        public FunctionCall {
            arguments = List.copyOf(arguments);
        }
    }

    /** {@code &target}: target is an Identifier or ArrayAccess. */
    record AddressOf(Expr target, int line) implements Expr {}

    /** {@code *pointer} */
    record Dereference(Expr pointer, int line) implements Expr {}

    /** {@code MALLOC(size)} */
    record Allocation(Expr size, int line) implements Expr {}

    /** {@code SIZE_OF(type)} */
    record SizeOf(DataType type, int line) implements Expr {}

    enum BinaryOperator {
        ADD("+"),
        SUBTRACT("-"),
        MULTIPLY("*"),
        DIVIDE("/"),
        DIV("DIV"),
        MOD("MOD"),
        CONCAT("&"),
        EQUAL("="),
        NOT_EQUAL("<>"),
        LESS("<"),
        GREATER(">"),
        LESS_EQUAL("<="),
        GREATER_EQUAL(">="),
        AND("AND"),
        OR("OR");

        private final String symbol;

        BinaryOperator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public boolean isComparison() {
            return ordinal() >= EQUAL.ordinal() && ordinal() <= GREATER_EQUAL.ordinal();
        }

        static BinaryOperator fromSymbol(String symbol) {
            for (BinaryOperator op : values()) {
                if (op.symbol.equals(symbol)) {
                    return op;
                }
            }
            throw new IllegalArgumentException("Unknown operator: " + symbol);
        }
    }

    enum UnaryOperator {
        NEGATE,
        NOT
    }
}
