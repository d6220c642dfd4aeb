package io.github.manjago.pseudomem.core;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Read-only view of the simulated arena, for visualizers and tooling.
 */
public interface MemoryView {

    /**
     * Total slot count.
     */
    int getSize();

    /**
     * Addresses below this are never handed out.
     */
    int getReservedSize();

    /**
     * Current free-address watermark.
     */
    int getNextFreeAddress();

    boolean isAllocated(int address);

    /**
     * Value at an address without bounds or allocation checks.
     *
     * @return the stored value, or null if out of range, unallocated or never written
     */
    @Nullable Value peek(int address);

    /**
     * Block owning an address, which may be interior to the block.
     *
     * @return the allocation, or null if the address is not allocated
     */
    @Nullable Allocation getAllocation(int address);

    /**
     * Live blocks ordered by address.
     */
    List<Allocation> getAllocations();

    MemoryStats getStats();

    /**
     * Hex/ASCII rendering of a range of slots.
     */
    String generateHexDump(int start, int length);

    default String generateHexDump(int start) {
        return generateHexDump(start, 256);
    }
}
