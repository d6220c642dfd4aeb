package io.github.manjago.pseudomem.core;

/**
 * Snapshot of arena usage.
 */
public record MemoryStats(
    int total,
    int reserved,
    int allocated,
    int free,
    int blocks,
    int nextFreeAddress
) {

    public double usagePercent() {
        int usable = total - reserved;
        return usable > 0 ? 100.0 * allocated / usable : 0;
    }

    @Override
    public String toString() {
        return String.format(
            "Memory: %,d slots (%,d reserved), %,d allocated in %d blocks, %,d free, watermark 0x%04X",
            total, reserved, allocated, blocks, free, nextFreeAddress);
    }
}
