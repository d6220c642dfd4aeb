package io.github.manjago.pseudomem.core;

/**
 * Live arena block.
 *
 * @param type type tag, e.g. {@code INTEGER}, {@code ARRAY OF REAL}, {@code MALLOC}
 */
public record Allocation(int address, int size, String type) {

    public int end() {
        return address + size;
    }

    public boolean contains(int addr) {
        return addr >= address && addr < end();
    }

    @Override
    public String toString() {
        return String.format("[0x%04X, 0x%04X) %s", address, end(), type);
    }
}
