package org.vivarium.memory.sensory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.vivarium.runtime.model.Event;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class SensoryBufferTest {

    private static final double NOW = 1_700_000_000.0;

    private SensoryBuffer buffer;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.ofEpochSecond((long) NOW), ZoneOffset.UTC);
        buffer = new SensoryBuffer(SensoryBufferSettings.defaults(), clock);
    }

    @Test
    @DisplayName("A single high-intensity event is promoted once")
    void highIntensityEventIsPromotedOnce() {
        buffer.push(new Event("shock", -0.9, NOW));

        try (PromotionBatch batch = buffer.drainPromotable()) {
            assertThat(batch.events()).extracting(Event::type).containsExactly("shock");
            batch.commit();
        }

        assertThat(buffer.size()).isZero();
        try (PromotionBatch second = buffer.drainPromotable()) {
            assertThat(second.size()).isZero();
        }
    }

    @Test
    @DisplayName("Low-intensity events need exactly the repetition threshold")
    void lowIntensityEventsNeedRepetitionThreshold() {
        for (int i = 0; i < 4; i++) {
            buffer.push(new Event("noise", 0.3, NOW));
        }
        try (PromotionBatch batch = buffer.drainPromotable()) {
            assertThat(batch.size()).isZero();
            batch.commit();
        }
        assertThat(buffer.size()).isEqualTo(4);

        buffer.push(new Event("noise", 0.3, NOW));
        try (PromotionBatch batch = buffer.drainPromotable()) {
            assertThat(batch.size()).isEqualTo(1);
            assertThat(batch.consumedEntries()).isEqualTo(5);
            batch.commit();
        }
        assertThat(buffer.size()).isZero();
    }

    @Test
    void repetitionGroupIsRepresentedByItsMostIntenseEvent() {
        double[] intensities = {0.1, -0.4, 0.2, 0.4, 0.3};
        for (double intensity : intensities) {
            buffer.push(new Event("decay", intensity, NOW));
        }

        try (PromotionBatch batch = buffer.drainPromotable()) {
            assertThat(batch.events()).singleElement()
                .satisfies(e -> assertThat(e.intensity()).isEqualTo(0.4));
        }
    }

    @Test
    @DisplayName("An uncommitted batch leaves the buffer untouched")
    void uncommittedBatchKeepsEvents() {
        buffer.push(new Event("shock", 1.0, NOW));

        try (PromotionBatch batch = buffer.drainPromotable()) {
            assertThat(batch.size()).isEqualTo(1);
        }

        assertThat(buffer.size()).isEqualTo(1);
    }

    @Test
    void evictsOldestEventWhenFull() {
        SensoryBuffer small = new SensoryBuffer(new SensoryBufferSettings(true, 3, 30.0, 0.8, 5),
            Clock.fixed(Instant.ofEpochSecond((long) NOW), ZoneOffset.UTC));
        for (int i = 0; i < 5; i++) {
            small.push(new Event("noise", 0.1 * i, NOW + i));
        }

        assertThat(small.peek(null)).extracting(Event::timestamp).containsExactly(NOW + 2, NOW + 3, NOW + 4);
        assertThat(small.getStatistics()).containsEntry("total_entries_evicted", 2L);
    }

    @Test
    void peekReturnsMostRecentEvents() {
        buffer.push(new Event("a", 0.1, NOW));
        buffer.push(new Event("b", 0.1, NOW));
        buffer.push(new Event("c", 0.1, NOW));

        assertThat(buffer.peek(2)).extracting(Event::type).containsExactly("b", "c");
    }

    @Test
    void rejectsNonPositiveRepetitionThreshold() {
        assertThatThrownBy(() -> buffer.drainPromotable(0.8, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
