package io.github.manjago.pseudomem.core;

/**
 * Kinds of arena faults.
 */
public enum MemoryFault {
    /** Allocation of zero or negative size */
    INVALID_SIZE,
    /** No contiguous run of free slots */
    EXHAUSTED,
    /** Free of an address that does not start a live block (includes double free) */
    INVALID_FREE,
    /** Address outside the arena */
    OUT_OF_BOUNDS,
    /** Address inside the arena but not allocated */
    NOT_ALLOCATED
}
