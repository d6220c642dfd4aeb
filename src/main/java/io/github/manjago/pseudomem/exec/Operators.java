package io.github.manjago.pseudomem.exec;

import io.github.manjago.pseudomem.core.MemoryFault;
import io.github.manjago.pseudomem.core.MemoryFaultException;
import io.github.manjago.pseudomem.core.ProgramException;
import io.github.manjago.pseudomem.core.Value;
import io.github.manjago.pseudomem.lang.Expr.BinaryOperator;
import io.github.manjago.pseudomem.lang.Expr.UnaryOperator;

/**
 * Operator semantics. Operands are fully evaluated before these are applied.
 *
 * <p>Addresses take part in {@code +} and {@code -} (address ± number is an address,
 * address - address is a number) and in comparisons, where they compare as numbers.
 */
final class Operators {

    private Operators() {
    }

    static Value binary(BinaryOperator op, Value left, Value right, int line) {
        return switch (op) {
            case ADD, SUBTRACT -> additive(op, left, right, line);
            case MULTIPLY, DIVIDE, DIV, MOD -> multiplicative(op, number(left, line), number(right, line), line);
            case CONCAT -> Value.of(left.display() + right.display());
            case EQUAL -> Value.of(strictEquals(left, right));
            case NOT_EQUAL -> Value.of(!strictEquals(left, right));
            case LESS -> Value.of(compare(left, right, op, line) < 0);
            case GREATER -> Value.of(compare(left, right, op, line) > 0);
            case LESS_EQUAL -> Value.of(compare(left, right, op, line) <= 0);
            case GREATER_EQUAL -> Value.of(compare(left, right, op, line) >= 0);
            case AND -> Value.of(bool(left, op, line) && bool(right, op, line));
            case OR -> Value.of(bool(left, op, line) || bool(right, op, line));
        };
    }

    static Value unary(UnaryOperator op, Value operand, int line) {
        if (op == UnaryOperator.NEGATE) {
            if (!(operand instanceof Value.Num num)) {
                throw new ProgramException("Cannot negate a " + operand.kindName(), line);
            }
            return Value.of(-num.value());
        }
        if (!(operand instanceof Value.Bool bool)) {
            throw new ProgramException("NOT requires a boolean operand, got " + operand.kindName(), line);
        }
        return Value.of(!bool.value());
    }

    /**
     * Same kind and same content. Numbers and addresses compare numerically.
     */
    static boolean strictEquals(Value left, Value right) {
        if (isNumeric(left) && isNumeric(right)) {
            return numeric(left) == numeric(right);
        }
        return left.equals(right);
    }

    private static Value additive(BinaryOperator op, Value left, Value right, int line) {
        boolean subtract = op == BinaryOperator.SUBTRACT;
        if (left instanceof Value.Address a && right instanceof Value.Address b) {
            if (!subtract) {
                throw new ProgramException("Cannot add two addresses", line);
            }
            return Value.of((double) a.value() - b.value());
        }
        if (left instanceof Value.Address a) {
            long offset = offset(right, line);
            return pointer(a.value(), subtract ? -offset : offset, line);
        }
        if (right instanceof Value.Address b && !subtract) {
            return pointer(b.value(), offset(left, line), line);
        }
        double l = number(left, line);
        double r = number(right, line);
        return Value.of(subtract ? l - r : l + r);
    }

    private static Value multiplicative(BinaryOperator op, double left, double right, int line) {
        if (right == 0 && op != BinaryOperator.MULTIPLY) {
            throw new ProgramException(op == BinaryOperator.MOD ? "Modulo by zero" : "Division by zero", line);
        }
        return switch (op) {
            case MULTIPLY -> Value.of(left * right);
            case DIVIDE -> Value.of(left / right);
            case DIV -> Value.of(Math.floor(left / right));
            default -> Value.of(left % right);
        };
    }

    private static int compare(Value left, Value right, BinaryOperator op, int line) {
        if (isNumeric(left) && isNumeric(right)) {
            return Double.compare(numeric(left), numeric(right));
        }
        if (left instanceof Value.Text a && right instanceof Value.Text b) {
            return a.value().compareTo(b.value());
        }
        throw new ProgramException("Invalid comparison: cannot apply '" + op.symbol() + "' to "
                + left.kindName() + " and " + right.kindName(), line);
    }

    private static double number(Value value, int line) {
        if (!(value instanceof Value.Num num)) {
            throw new ProgramException("Cannot perform arithmetic on non-numbers (got " + value.kindName() + ")", line);
        }
        return num.value();
    }

    private static long offset(Value value, int line) {
        double n = number(value, line);
        if (n != Math.floor(n)) {
            throw new ProgramException("Pointer offset must be a whole number, got " + value.display(), line);
        }
        if (Math.abs(n) > Integer.MAX_VALUE) {
            throw new MemoryFaultException(MemoryFault.OUT_OF_BOUNDS,
                    "Pointer offset " + value.display() + " is out of range").withLine(line);
        }
        return (long) n;
    }

    private static Value pointer(int base, long offset, int line) {
        long target = base + offset;
        if (target < Integer.MIN_VALUE || target > Integer.MAX_VALUE) {
            throw new MemoryFaultException(MemoryFault.OUT_OF_BOUNDS,
                    "Pointer arithmetic out of range: " + base + (offset < 0 ? " - " + -offset : " + " + offset))
                    .withLine(line);
        }
        return Value.address((int) target);
    }

    private static boolean bool(Value value, BinaryOperator op, int line) {
        if (!(value instanceof Value.Bool b)) {
            throw new ProgramException(op.symbol() + " requires boolean operands, got " + value.kindName(), line);
        }
        return b.value();
    }

    private static boolean isNumeric(Value value) {
        return value instanceof Value.Num || value instanceof Value.Address;
    }

    private static double numeric(Value value) {
        return value instanceof Value.Num num ? num.value() : ((Value.Address) value).value();
    }
}
