package org.vivarium.runtime;

/**
 * Fixed-capacity ring of per-tick peak intensities.
 * <p>
 * The smoothed value is computed from the ring on demand as
 * {@code sum(alpha * (1 - alpha)^i * x_i)} with {@code i = 0} for the newest sample, so it holds
 * no hidden accumulator and restores exactly from its samples.
 */
public final class IntensityHistory {

    private final double[] samples;
    private final double alpha;
    private int head;
    private int size;

    /**
     * @param capacity Number of samples kept.
     * @param alpha    Smoothing factor in {@code (0, 1]}.
     */
    public IntensityHistory(int capacity, double alpha) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        if (alpha <= 0.0 || alpha > 1.0) {
            throw new IllegalArgumentException("alpha must be within (0, 1]");
        }
        this.samples = new double[capacity];
        this.alpha = alpha;
    }

    /**
     * @param peak The largest event magnitude of a tick, 0 for a quiet tick.
     */
    public void record(double peak) {
        samples[head] = peak;
        head = (head + 1) % samples.length;
        if (size < samples.length) {
            size++;
        }
    }

    public double smoothed() {
        double value = 0.0;
        double weight = alpha;
        for (int i = 0; i < size; i++) {
            value += weight * sampleAt(i);
            weight *= 1.0 - alpha;
        }
        return value;
    }

    public double mean() {
        if (size == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (int i = 0; i < size; i++) {
            sum += sampleAt(i);
        }
        return sum / size;
    }

    /**
     * @return population standard deviation of the samples.
     */
    public double volatility() {
        if (size < 2) {
            return 0.0;
        }
        double mean = mean();
        double squares = 0.0;
        for (int i = 0; i < size; i++) {
            double d = sampleAt(i) - mean;
            squares += d * d;
        }
        return Math.sqrt(squares / size);
    }

    public int size() {
        return size;
    }

    public void clear() {
        head = 0;
        size = 0;
    }

    // 0 is the newest sample
    private double sampleAt(int age) {
        int index = Math.floorMod(head - 1 - age, samples.length);
        return samples[index];
    }
}
