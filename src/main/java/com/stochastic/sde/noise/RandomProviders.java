package com.stochastic.sde.noise;

import org.apache.commons.rng.RestorableUniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;

/**
 * Factory for the pseudo-random generators that drive the noise processes.
 *
 * XO_SHI_RO_256_PP is used throughout: 256-bit state, fast, and restorable, so
 * a run can be replayed exactly from its seed.
 */
public final class RandomProviders {
    private static final long GOLDEN_GAMMA = 0x9e3779b97f4a7c15L;

    private RandomProviders() {
        // Utility class
    }

    /** Creates a seeded generator. Same seed, same increments. */
    public static RestorableUniformRandomProvider create(long seed) {
        return (RestorableUniformRandomProvider) RandomSource.XO_SHI_RO_256_PP.create(seed);
    }

    /** Creates a generator seeded from system entropy. */
    public static RestorableUniformRandomProvider createUnseeded() {
        return (RestorableUniformRandomProvider) RandomSource.XO_SHI_RO_256_PP.create();
    }

    /**
     * Derives the seed of the {@code index}-th independent stream from a base
     * seed using the SplitMix64 finalizer, so that neighbouring trajectories do
     * not receive correlated seeds.
     */
    public static long streamSeed(long baseSeed, long index) {
        long z = baseSeed + (index + 1) * GOLDEN_GAMMA;
        z = (z ^ (z >>> 30)) * 0xbf58476d1ce4e5b9L;
        z = (z ^ (z >>> 27)) * 0x94d049bb133111ebL;
        return z ^ (z >>> 31);
    }
}
