package io.github.manjago.pseudomem.exec;

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;

/**
 * Seeded generator behind RANDOM().
 *
 * Uses Apache Commons RNG XO_RO_SHI_RO_128_PP so that a fixed seed replays
 * the same sequence across runs.
 */
public final class ProgramRng {

    /** Fixed algorithm: changing it changes every seeded run. */
    private static final RandomSource ALGORITHM = RandomSource.XO_RO_SHI_RO_128_PP;

    private final long initialSeed;
    private final UniformRandomProvider rng;

    public ProgramRng(long seed) {
        this.initialSeed = seed;
        this.rng = ALGORITHM.create(seed);
    }

    /**
     * Returns uniformly distributed double in [0, 1).
     */
    public double nextDouble() {
        return rng.nextDouble();
    }

    /**
     * Get initial seed (for logging/debugging).
     */
    public long getInitialSeed() {
        return initialSeed;
    }
}
