package org.vivarium.runtime.spi;

import java.util.Random;

/**
 * Source of randomness for runtime components. Implementations are deterministic for a
 * given seed so that runs can be reproduced.
 */
public interface IRandomProvider {

    /**
     * @return the underlying {@link Random}, for APIs that require one.
     */
    Random asJavaRandom();

    /**
     * @return a uniformly distributed value in {@code [0, 1)}.
     */
    double nextDouble();

    /**
     * @param bound Exclusive upper bound, must be positive.
     * @return a uniformly distributed value in {@code [0, bound)}.
     */
    int nextInt(int bound);

    /**
     * Creates an independent, deterministic stream for a named consumer.
     *
     * @param context Name of the consumer, e.g. {@code "feedback"}.
     * @param salt    Additional discriminator.
     * @return A provider whose sequence depends only on this provider's seed, the context and the salt.
     */
    IRandomProvider deriveFor(String context, long salt);

    /**
     * @return an opaque representation of the current generator state.
     */
    byte[] saveState();

    /**
     * Restores a state previously produced by {@link #saveState()}.
     * @param state The saved state.
     */
    void loadState(byte[] state);
}
