package io.github.manjago.pseudomem.core;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Fixed-size simulated address space.
 *
 * <p>Allocation is a forward scan starting at the free-address watermark. The watermark
 * only moves back when the highest block is freed, so freeing an older block leaves a
 * hole that later allocations never reuse. Each slot holds one {@link Value} regardless
 * of type, so every type has size 1.
 */
public class MemoryArena implements MemoryView {

    private static final Logger log = LoggerFactory.getLogger(MemoryArena.class);

    public static final int DEFAULT_SIZE = 65_536;
    public static final int DEFAULT_RESERVED = 1024;

    private static final int DUMP_ROW = 16;

    private final int size;
    private final int reserved;

    /** Slot contents. Null means never written (or cleared by free). */
    private final Value[] slots;

    /** Allocation marks, one bit per slot */
    private final BitSet allocated;

    /** Block start address -> block */
    private final TreeMap<Integer, Allocation> allocations = new TreeMap<>();

    private int nextFreeAddress;

    public MemoryArena() {
        this(DEFAULT_SIZE, DEFAULT_RESERVED);
    }

    public MemoryArena(int size, int reserved) {
        if (size <= 0) {
            throw new IllegalArgumentException("Size must be positive: " + size);
        }
        if (reserved < 0 || reserved >= size) {
            throw new IllegalArgumentException("Reserved region must be in [0, " + size + "): " + reserved);
        }
        this.size = size;
        this.reserved = reserved;
        this.slots = new Value[size];
        this.allocated = new BitSet(size);
        this.nextFreeAddress = reserved;

        log.debug("MemoryArena created with {} slots ({} reserved)", size, reserved);
    }

    // ========== Allocation ==========

    /**
     * Allocate {@code count} consecutive slots.
     *
     * @param type type tag recorded for the block
     * @return start address
     * @throws MemoryFaultException INVALID_SIZE or EXHAUSTED
     */
    public int allocate(int count, String type) {
        if (count <= 0) {
            throw new MemoryFaultException(MemoryFault.INVALID_SIZE,
                    "Invalid allocation size: " + count);
        }

        int address = count > size - reserved ? -1 : findFreeBlock(count);
        if (address < 0) {
            log.warn("Allocation of {} slots failed (watermark 0x{})", count, Integer.toHexString(nextFreeAddress));
            throw new MemoryFaultException(MemoryFault.EXHAUSTED,
                    "Memory allocation failed: cannot find contiguous block of " + count + " slots");
        }

        allocated.set(address, address + count);
        allocations.put(address, new Allocation(address, count, type));
        nextFreeAddress = Math.max(nextFreeAddress, address + count);

        log.trace("Allocated [{}, {}) as {}", address, address + count, type);
        return address;
    }

    /**
     * Forward scan from the watermark, restarting after each obstruction.
     */
    private int findFreeBlock(int count) {
        int address = nextFreeAddress;
        while (count <= size - address) {
            int obstruction = allocated.nextSetBit(address);
            if (obstruction < 0 || obstruction - address >= count) {
                return address;
            }
            address = obstruction + 1;
        }
        return -1;
    }

    /**
     * Free the block starting exactly at {@code address}.
     *
     * @return the freed block
     * @throws MemoryFaultException INVALID_FREE for interior, unallocated or already freed addresses
     */
    public Allocation free(int address) {
        Allocation block = allocations.get(address);
        if (block == null) {
            throw new MemoryFaultException(MemoryFault.INVALID_FREE,
                    "Invalid free: address " + address + " not allocated");
        }

        for (int i = block.address(); i < block.end(); i++) {
            slots[i] = null;
        }
        allocated.clear(block.address(), block.end());
        allocations.remove(address);

        if (block.end() >= nextFreeAddress) {
            nextFreeAddress = allocations.isEmpty()
                    ? reserved
                    : Math.max(reserved, allocations.lastEntry().getValue().end());
        }

        log.trace("Freed [{}, {}) {}", block.address(), block.end(), block.type());
        return block;
    }

    // ========== Access ==========

    /**
     * Read an allocated slot.
     *
     * @return the value, or null if the slot was never written
     * @throws MemoryFaultException OUT_OF_BOUNDS or NOT_ALLOCATED
     */
    public @Nullable Value read(int address) {
        checkAccess("read", address);
        return slots[address];
    }

    /**
     * Write an allocated slot.
     *
     * @throws MemoryFaultException OUT_OF_BOUNDS or NOT_ALLOCATED
     */
    public void write(int address, Value value) {
        checkAccess("write", address);
        slots[address] = value;
    }

    private void checkAccess(String action, int address) {
        if (address < 0 || address >= size) {
            throw new MemoryFaultException(MemoryFault.OUT_OF_BOUNDS,
                    "Memory " + action + " error: address " + address + " out of bounds (0-" + (size - 1) + ")");
        }
        if (!allocated.get(address)) {
            throw new MemoryFaultException(MemoryFault.NOT_ALLOCATED,
                    "Memory " + action + " error: address " + address + " not allocated");
        }
    }

    /**
     * Size in slots of a value of the given type name. Every type occupies one slot.
     */
    public static int typeSize(String typeName) {
        return switch (typeName) {
            case "INTEGER", "REAL", "CHAR", "STRING", "BOOLEAN",
                 "POINTER_TO_INTEGER", "POINTER_TO_REAL", "POINTER_TO_CHAR", "VOID_POINTER" -> 1;
            default -> {
                if (typeName.startsWith("ARRAY")) {
                    yield 1;
                }
                throw new IllegalArgumentException("Unknown type: " + typeName);
            }
        };
    }

    // ========== MemoryView ==========

    @Override
    public int getSize() {
        return size;
    }

    @Override
    public int getReservedSize() {
        return reserved;
    }

    @Override
    public int getNextFreeAddress() {
        return nextFreeAddress;
    }

    @Override
    public boolean isAllocated(int address) {
        return address >= 0 && address < size && allocated.get(address);
    }

    @Override
    public @Nullable Value peek(int address) {
        return isAllocated(address) ? slots[address] : null;
    }

    @Override
    public @Nullable Allocation getAllocation(int address) {
        Map.Entry<Integer, Allocation> entry = allocations.floorEntry(address);
        if (entry != null && entry.getValue().contains(address)) {
            return entry.getValue();
        }
        return null;
    }

    @Override
    public List<Allocation> getAllocations() {
        return new ArrayList<>(allocations.values());
    }

    @Override
    public MemoryStats getStats() {
        int used = allocated.cardinality();
        return new MemoryStats(size, reserved, used, size - reserved - used, allocations.size(), nextFreeAddress);
    }

    @Override
    public String generateHexDump(int start, int length) {
        int from = Math.max(0, start);
        int to = Math.min(size, from + Math.max(0, length));

        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Memory Hex Dump (0x%04X - 0x%04X)\n", from, Math.max(from, to - 1)));
        sb.append("=".repeat(70)).append('\n');

        for (int row = from; row < to; row += DUMP_ROW) {
            StringBuilder ascii = new StringBuilder();
            sb.append(String.format("0x%04X: ", row));
            for (int i = 0; i < DUMP_ROW; i++) {
                int address = row + i;
                if (i == DUMP_ROW / 2) {
                    sb.append(' ');
                }
                if (address >= to) {
                    sb.append("   ");
                    ascii.append(' ');
                } else if (!allocated.get(address)) {
                    sb.append(".. ");
                    ascii.append('.');
                } else if (slots[address] == null) {
                    sb.append("?? ");
                    ascii.append('?');
                } else {
                    int b = lowByte(slots[address]);
                    sb.append(String.format("%02X ", b));
                    ascii.append(b >= 32 && b <= 126 ? (char) b : '.');
                }
            }
            sb.append('|').append(ascii).append('|').append('\n');
        }
        return sb.toString();
    }

    private static int lowByte(Value value) {
        if (value instanceof Value.Num num) {
            return (int) ((long) num.value() & 0xFF);
        }
        if (value instanceof Value.Address address) {
            return address.value() & 0xFF;
        }
        if (value instanceof Value.Bool bool) {
            return bool.value() ? 1 : 0;
        }
        String text = ((Value.Text) value).value();
        return text.isEmpty() ? 0 : text.charAt(0) & 0xFF;
    }
}
