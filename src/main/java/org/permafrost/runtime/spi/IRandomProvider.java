package org.permafrost.runtime.spi;

import java.util.List;

/**
 * Source of randomness for discrete decay events and fallback placement.
 * <p>
 * A region load draws from sub-streams keyed by region id and purpose, so the outcome of one
 * decay pass never depends on how many draws another pass made.
 */
public interface IRandomProvider {

    /**
     * @param bound exclusive upper bound, must be > 0
     * @return a uniform int in [0, bound)
     */
    int nextInt(int bound);

    /**
     * @return a uniform double in [0.0, 1.0)
     */
    double nextDouble();

    /**
     * @param min inclusive lower bound
     * @param max exclusive upper bound
     * @return a uniform double in [min, max)
     */
    default double nextDouble(double min, double max) {
        return min + nextDouble() * (max - min);
    }

    /**
     * @param probability probability of success; values outside [0, 1] saturate
     * @return true with the given probability
     */
    default boolean chance(double probability) {
        return nextDouble() < probability;
    }

    /**
     * Rounds an expected count up or down so that the mean over many draws equals {@code expected}.
     *
     * @param expected non-negative expected count; values of {@code Integer.MAX_VALUE} or more
     *                 yield {@code Integer.MAX_VALUE}
     * @return floor or ceiling of {@code expected}
     */
    default int roundStochastically(double expected) {
        if (expected >= Integer.MAX_VALUE) {
            return Integer.MAX_VALUE;
        }
        int whole = (int) Math.floor(expected);
        return chance(expected - whole) ? whole + 1 : whole;
    }

    /**
     * @param candidates non-empty list
     * @return a uniformly chosen element
     */
    default <T> T pick(List<T> candidates) {
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("Cannot pick from an empty list");
        }
        return candidates.get(nextInt(candidates.size()));
    }

    /**
     * Creates an independent sub-stream that depends only on this provider's seed, the scope and
     * the key, never on how many values were drawn from this provider.
     *
     * @param scope purpose of the stream, e.g. "placement" or "floorErosion"
     * @param key region id
     * @return the derived provider
     */
    IRandomProvider deriveFor(String scope, long key);
}
