package io.github.manjago.pseudomem.core;

/**
 * Run-time value. One case per kind of data a slot or variable can hold;
 * arrays live in their variable, never in a {@code Value}.
 */
public sealed interface Value {

    /** Text shown by OUTPUT and string concatenation. */
    String display();

    /** Kind name used in error messages. */
    String kindName();

    record Num(double value) implements Value {

        public boolean isIntegral() {
            return !Double.isInfinite(value) && value == Math.floor(value);
        }

        @Override
        public String display() {
            if (isIntegral() && Math.abs(value) < 1e15) {
                return Long.toString((long) value);
            }
            return Double.toString(value);
        }

        @Override
        public String kindName() {
            return "number";
        }
    }

    record Text(String value) implements Value {
        @Override
        public String display() {
            return value;
        }

        @Override
        public String kindName() {
            return "string";
        }
    }

    record Bool(boolean value) implements Value {
        @Override
        public String display() {
            return value ? "TRUE" : "FALSE";
        }

        @Override
        public String kindName() {
            return "boolean";
        }
    }

    /** Arena address held by a pointer. */
    record Address(int value) implements Value {
        @Override
        public String display() {
            return Integer.toString(value);
        }

        @Override
        public String kindName() {
            return "address";
        }
    }

    static Value of(double value) {
        return new Num(value);
    }

    static Value of(String value) {
        return new Text(value);
    }

    static Value of(boolean value) {
        return new Bool(value);
    }

    static Value address(int value) {
        return new Address(value);
    }
}
