package com.marketsim.core;

/**
 * Derives independent, reproducible seeds for each symbol and agent from the
 * one configured seed.
 */
public final class Seeds {

    private Seeds() {
    }

    /**
     * @param stream 0 for the symbol's price process, the agent id for agents
     */
    public static long derive(long seed, String symbol, long stream) {
        long h = mix(seed);
        for (int i = 0; i < symbol.length(); i++) {
            h = mix(h ^ symbol.charAt(i));
        }
        return mix(h ^ stream);
    }

    // SplitMix64 finaliser
    private static long mix(long z) {
        z += 0x9E3779B97F4A7C15L;
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }
}
