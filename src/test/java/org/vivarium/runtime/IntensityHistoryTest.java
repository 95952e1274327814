package org.vivarium.runtime;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class IntensityHistoryTest {

    @Test
    void smoothedWeightsNewestSampleMost() {
        IntensityHistory history = new IntensityHistory(4, 0.5);
        history.record(1.0);
        history.record(0.0);

        assertThat(history.smoothed()).isCloseTo(0.25, within(1e-12));
        assertThat(history.mean()).isCloseTo(0.5, within(1e-12));
        assertThat(history.volatility()).isCloseTo(0.5, within(1e-12));
    }

    @Test
    void oldestSamplesFallOutOfTheRing() {
        IntensityHistory history = new IntensityHistory(2, 1.0);
        history.record(0.9);
        history.record(0.1);
        history.record(0.3);

        assertThat(history.size()).isEqualTo(2);
        assertThat(history.mean()).isCloseTo(0.2, within(1e-12));
        assertThat(history.smoothed()).isCloseTo(0.3, within(1e-12));
    }

    @Test
    void emptyHistoryIsQuiet() {
        IntensityHistory history = new IntensityHistory(3, 0.3);
        history.record(0.7);
        history.clear();

        assertThat(history.size()).isZero();
        assertThat(history.smoothed()).isZero();
        assertThat(history.mean()).isZero();
        assertThat(history.volatility()).isZero();
    }

    @Test
    void rejectsInvalidParameters() {
        assertThatThrownBy(() -> new IntensityHistory(0, 0.3)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new IntensityHistory(3, 0.0)).isInstanceOf(IllegalArgumentException.class);
    }
}
