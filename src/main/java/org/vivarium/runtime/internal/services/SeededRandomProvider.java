package org.vivarium.runtime.internal.services;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Random;

import org.vivarium.runtime.spi.IRandomProvider;

/**
 * {@link IRandomProvider} backed by a seeded {@link Random}.
 */
public class SeededRandomProvider implements IRandomProvider {

    private final long seed;
    private Random random;

    public SeededRandomProvider(long seed) {
        this.seed = seed;
        this.random = new Random(seed);
    }

    public long getSeed() {
        return seed;
    }

    @Override
    public Random asJavaRandom() {
        return random;
    }

    @Override
    public double nextDouble() {
        return random.nextDouble();
    }

    @Override
    public int nextInt(int bound) {
        return random.nextInt(bound);
    }

    @Override
    public IRandomProvider deriveFor(String context, long salt) {
        long h = seed;
        for (byte b : context.getBytes(StandardCharsets.UTF_8)) {
            h = mix(h ^ b);
        }
        return new SeededRandomProvider(mix(h ^ salt));
    }

    @Override
    public byte[] saveState() {
        try (ByteArrayOutputStream bytes = new ByteArrayOutputStream();
             ObjectOutputStream out = new ObjectOutputStream(bytes)) {
            out.writeObject(random);
            out.flush();
            return bytes.toByteArray();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to save random state", e);
        }
    }

    @Override
    public void loadState(byte[] state) {
        try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(state))) {
            this.random = (Random) in.readObject();
        } catch (IOException | ClassNotFoundException | ClassCastException e) {
            throw new IllegalArgumentException("Invalid random state", e);
        }
    }

    // SplitMix64 finalizer
    private static long mix(long z) {
        z = (z ^ (z >>> 30)) * 0xbf58476d1ce4e5b9L;
        z = (z ^ (z >>> 27)) * 0x94d049bb133111ebL;
        return z ^ (z >>> 31);
    }
}
