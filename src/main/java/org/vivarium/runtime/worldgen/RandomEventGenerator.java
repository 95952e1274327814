package org.vivarium.runtime.worldgen;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.vivarium.runtime.model.Event;
import org.vivarium.runtime.spi.IEventSource;
import org.vivarium.runtime.spi.IRandomProvider;

import com.typesafe.config.Config;

/**
 * Event source that draws event types from a weighted distribution and intensities
 * uniformly from a per-type range.
 * <p>
 * Default weights: noise 0.4, decay 0.3, recovery 0.2, shock 0.05, idle 0.05.
 * Default ranges: noise {@code [-0.3, 0.3]}, decay {@code [-0.5, 0]}, recovery {@code [0, 0.5]},
 * shock {@code [-1, 1]}, idle {@code 0}.
 */
public class RandomEventGenerator implements IEventSource {

    private record Range(double min, double max) {
    }

    private static final Map<String, Range> DEFAULT_RANGES = Map.of(
        "noise", new Range(-0.3, 0.3),
        "decay", new Range(-0.5, 0.0),
        "recovery", new Range(0.0, 0.5),
        "shock", new Range(-1.0, 1.0),
        "idle", new Range(0.0, 0.0));

    private final IRandomProvider random;
    private final Clock clock;
    private final Map<String, Double> weights = new LinkedHashMap<>();
    private final double totalWeight;

    /**
     * @param random  Random source.
     * @param options The {@code eventSource} config block. An optional {@code weights} block
     *                replaces the default distribution.
     * @param clock   Clock used for event timestamps.
     */
    public RandomEventGenerator(IRandomProvider random, Config options, Clock clock) {
        this.random = random;
        this.clock = clock;
        if (options.hasPath("weights")) {
            Config configured = options.getConfig("weights");
            for (String type : configured.root().keySet()) {
                weights.put(type, configured.getDouble(type));
            }
        } else {
            weights.put("noise", 0.4);
            weights.put("decay", 0.3);
            weights.put("recovery", 0.2);
            weights.put("shock", 0.05);
            weights.put("idle", 0.05);
        }
        double sum = 0.0;
        for (Map.Entry<String, Double> e : weights.entrySet()) {
            if (e.getValue() < 0.0) {
                throw new IllegalArgumentException("weights." + e.getKey() + " must be >= 0");
            }
            sum += e.getValue();
        }
        if (sum <= 0.0) {
            throw new IllegalArgumentException("At least one event weight must be positive");
        }
        this.totalWeight = sum;
    }

    public RandomEventGenerator(IRandomProvider random, Config options) {
        this(random, options, Clock.systemUTC());
    }

    @Override
    public Optional<Event> next() {
        String type = pickType();
        Range range = DEFAULT_RANGES.getOrDefault(type, new Range(-1.0, 1.0));
        double intensity = range.min() + (range.max() - range.min()) * random.nextDouble();
        return Optional.of(new Event(type, intensity, clock.millis() / 1000.0, Map.of("source", "generator")));
    }

    private String pickType() {
        double roll = random.nextDouble() * totalWeight;
        String last = null;
        for (Map.Entry<String, Double> e : weights.entrySet()) {
            roll -= e.getValue();
            last = e.getKey();
            if (roll < 0.0) {
                return e.getKey();
            }
        }
        return last;
    }
}
