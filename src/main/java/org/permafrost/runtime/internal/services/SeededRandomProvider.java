package org.permafrost.runtime.internal.services;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.permafrost.runtime.spi.IRandomProvider;

import java.nio.charset.StandardCharsets;

/**
 * {@link IRandomProvider} backed by Commons Math {@link Well19937c}.
 * <p>
 * Derived streams are seeded with the full seed material (root seed, scope bytes, key) as an
 * int array, which Well19937c mixes into its 624-word state.
 */
public final class SeededRandomProvider implements IRandomProvider {

    private final int[] seedMaterial;
    private final RandomGenerator rng;

    public SeededRandomProvider(long seed) {
        this(new int[] {(int) (seed >>> 32), (int) seed});
    }

    private SeededRandomProvider(int[] seedMaterial) {
        this.seedMaterial = seedMaterial;
        this.rng = new Well19937c(seedMaterial);
    }

    @Override
    public int nextInt(int bound) {
        return rng.nextInt(bound);
    }

    @Override
    public double nextDouble() {
        return rng.nextDouble();
    }

    @Override
    public IRandomProvider deriveFor(String scope, long key) {
        byte[] scopeBytes = scope.getBytes(StandardCharsets.UTF_8);
        int[] derived = new int[seedMaterial.length + scopeBytes.length + 3];
        int i = 0;
        for (int word : seedMaterial) {
            derived[i++] = word;
        }
        // length prefix keeps ("ab", key) and ("a", ...) from sharing a prefix
        derived[i++] = scopeBytes.length;
        for (byte b : scopeBytes) {
            derived[i++] = b;
        }
        derived[i++] = (int) (key >>> 32);
        derived[i] = (int) key;
        return new SeededRandomProvider(derived);
    }
}
