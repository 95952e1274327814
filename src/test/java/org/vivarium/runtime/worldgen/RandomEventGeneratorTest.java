package org.vivarium.runtime.worldgen;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.vivarium.runtime.internal.services.SeededRandomProvider;
import org.vivarium.runtime.model.Event;

import com.typesafe.config.ConfigFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class RandomEventGeneratorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochSecond(1_000), ZoneOffset.UTC);

    @Test
    void sameSeedProducesSameSequence() {
        RandomEventGenerator a = new RandomEventGenerator(new SeededRandomProvider(42), ConfigFactory.empty(), CLOCK);
        RandomEventGenerator b = new RandomEventGenerator(new SeededRandomProvider(42), ConfigFactory.empty(), CLOCK);

        for (int i = 0; i < 50; i++) {
            assertThat(a.next()).isEqualTo(b.next());
        }
    }

    @Test
    void intensitiesStayWithinTheTypeRange() {
        RandomEventGenerator generator = new RandomEventGenerator(new SeededRandomProvider(3), ConfigFactory.empty(), CLOCK);

        for (int i = 0; i < 500; i++) {
            Event event = generator.next().orElseThrow();
            switch (event.type()) {
                case "noise" -> assertThat(event.intensity()).isBetween(-0.3, 0.3);
                case "decay" -> assertThat(event.intensity()).isBetween(-0.5, 0.0);
                case "recovery" -> assertThat(event.intensity()).isBetween(0.0, 0.5);
                case "idle" -> assertThat(event.intensity()).isZero();
                default -> assertThat(event.type()).isEqualTo("shock");
            }
            assertThat(event.timestamp()).isEqualTo(1_000.0);
            assertThat(event.metadata()).containsEntry("source", "generator");
        }
    }

    @Test
    void configuredWeightsReplaceDefaults() {
        RandomEventGenerator generator = new RandomEventGenerator(new SeededRandomProvider(5),
            ConfigFactory.parseMap(Map.of("weights", Map.of("shock", 1.0, "noise", 0.0))), CLOCK);

        for (int i = 0; i < 100; i++) {
            assertThat(generator.next().orElseThrow().type()).isEqualTo("shock");
        }
    }

    @Test
    void rejectsUnusableWeights() {
        assertThatThrownBy(() -> new RandomEventGenerator(new SeededRandomProvider(1),
            ConfigFactory.parseMap(Map.of("weights", Map.of("noise", -1.0))), CLOCK))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RandomEventGenerator(new SeededRandomProvider(1),
            ConfigFactory.parseMap(Map.of("weights", Map.of("noise", 0.0))), CLOCK))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("positive");
    }
}
