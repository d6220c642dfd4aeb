package io.github.manjago.pseudomem.exec;

import io.github.manjago.pseudomem.core.ProgramException;
import io.github.manjago.pseudomem.core.Value;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Built-in functions. Checked before user-defined functions.
 */
final class Builtins {

    static final Set<String> NAMES = Set.of(
        "LENGTH", "SUBSTRING", "UCASE", "LCASE", "INT", "REAL", "STRING", "ROUND", "RANDOM", "EOF");

    private final ProgramRng rng;
    private final FileSystem files;

    Builtins(ProgramRng rng, FileSystem files) {
        this.rng = rng;
        this.files = files;
    }

    static boolean isBuiltin(String name) {
        return NAMES.contains(name);
    }

    Value call(String name, List<Value> args, int line) {
        switch (name) {
            case "LENGTH" -> {
                arity(name, args, 1, line);
                return Value.of(text(name, args.get(0), line).length());
            }
            case "SUBSTRING" -> {
                arity(name, args, 3, line);
                String s = text(name, args.get(0), line);
                double start = number(name, args.get(1), line);
                double length = number(name, args.get(2), line);
                if (start < 1 || length < 0) {
                    throw new ProgramException("SUBSTRING start must be >= 1 and length >= 0", line);
                }
                int begin = (int) Math.min(s.length(), Math.floor(start) - 1);
                int end = (int) Math.min(s.length(), begin + Math.floor(length));
                return Value.of(s.substring(begin, end));
            }
            case "UCASE" -> {
                arity(name, args, 1, line);
                return Value.of(text(name, args.get(0), line).toUpperCase(Locale.ROOT));
            }
            case "LCASE" -> {
                arity(name, args, 1, line);
                return Value.of(text(name, args.get(0), line).toLowerCase(Locale.ROOT));
            }
            case "INT" -> {
                arity(name, args, 1, line);
                return Value.of(toInteger(args.get(0)));
            }
            case "REAL" -> {
                arity(name, args, 1, line);
                return Value.of(toReal(args.get(0)));
            }
            case "STRING" -> {
                arity(name, args, 1, line);
                return Value.of(args.get(0).display());
            }
            case "ROUND" -> {
                arity(name, args, 2, line);
                double value = number(name, args.get(0), line);
                double multiplier = Math.pow(10, number(name, args.get(1), line));
                return Value.of(Math.round(value * multiplier) / multiplier);
            }
            case "RANDOM" -> {
                arity(name, args, 0, line);
                return Value.of(rng.nextDouble());
            }
            case "EOF" -> {
                arity(name, args, 1, line);
                return Value.of(files.isAtEnd(args.get(0).display(), line));
            }
            default -> throw new IllegalArgumentException("Not a built-in: " + name);
        }
    }

    private static double toInteger(Value value) {
        if (value instanceof Value.Num num) {
            return Math.floor(num.value());
        }
        if (value instanceof Value.Text text) {
            double parsed = Conversions.parseLeadingInteger(text.value());
            return Double.isNaN(parsed) ? 0 : parsed;
        }
        if (value instanceof Value.Bool bool) {
            return bool.value() ? 1 : 0;
        }
        return ((Value.Address) value).value();
    }

    private static double toReal(Value value) {
        if (value instanceof Value.Text text) {
            double parsed = Conversions.parseLeadingDecimal(text.value());
            return Double.isNaN(parsed) ? 0 : parsed;
        }
        if (value instanceof Value.Bool bool) {
            return bool.value() ? 1 : 0;
        }
        return Conversions.numericCoercion(value);
    }

    private static void arity(String name, List<Value> args, int expected, int line) {
        if (args.size() != expected) {
            throw new ProgramException(name + " requires " + expected
                    + (expected == 1 ? " parameter" : " parameters") + ", got " + args.size(), line);
        }
    }

    private static String text(String name, Value value, int line) {
        if (!(value instanceof Value.Text text)) {
            throw new ProgramException(name + " requires a string parameter, got " + value.kindName(), line);
        }
        return text.value();
    }

    private static double number(String name, Value value, int line) {
        if (!(value instanceof Value.Num num)) {
            throw new ProgramException(name + " requires numeric parameters, got " + value.kindName(), line);
        }
        return num.value();
    }
}
