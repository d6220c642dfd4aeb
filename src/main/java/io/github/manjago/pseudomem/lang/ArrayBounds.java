package io.github.manjago.pseudomem.lang;

/**
 * Inclusive literal bounds of one array dimension.
 */
public record ArrayBounds(int lower, int upper) {

    public ArrayBounds {
        if (upper < lower) {
            throw new IllegalArgumentException("Upper bound " + upper + " below lower bound " + lower);
        }
    }

    /**
     * @throws ArithmeticException if the element count does not fit in an int
     */
    public int size() {
        return Math.toIntExact((long) upper - lower + 1);
    }

    public boolean contains(int index) {
        return index >= lower && index <= upper;
    }

    @Override
    public String toString() {
        return lower + ":" + upper;
    }
}
