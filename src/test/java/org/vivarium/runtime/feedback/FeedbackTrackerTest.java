package org.vivarium.runtime.feedback;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.vivarium.runtime.internal.services.SeededRandomProvider;
import org.vivarium.runtime.model.FeedbackRecord;
import org.vivarium.runtime.model.PendingAction;
import org.vivarium.runtime.model.ResponsePattern;
import org.vivarium.runtime.model.SelfState;
import org.vivarium.runtime.model.StateVector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class FeedbackTrackerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochSecond(1_700_000_000L), ZoneOffset.UTC);

    private FeedbackTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new FeedbackTracker(new SeededRandomProvider(7L), FeedbackSettings.defaults(), CLOCK);
    }

    @Test
    @DisplayName("Action a1 resolves after one tick with the observed energy drop")
    void resolvesForcedDelayScenario() {
        SelfState state = new SelfState();
        StateVector before = new StateVector(50.0, 0.8, 0.9);
        state.setEnergy(before.energy());
        state.setStability(before.stability());
        state.setIntegrity(before.integrity());

        tracker.registerAction("a1", ResponsePattern.ABSORB, before, 0.0, List.of("shock"), 1);
        state.advance(1.0);
        state.setEnergy(49.0);

        List<FeedbackRecord> records = tracker.observeConsequences(state);

        assertThat(records).hasSize(1);
        FeedbackRecord record = records.get(0);
        assertThat(record.actionId()).isEqualTo("a1");
        assertThat(record.stateDelta().energy()).isCloseTo(-1.0, within(1e-9));
        assertThat(record.delayTicks()).isEqualTo(1);
        assertThat(tracker.getPendingCount()).isZero();
    }

    @Test
    @DisplayName("Records are emitted only between the minimum delay and the timeout")
    void emitsWithinDelayBounds() {
        StateVector before = new StateVector(50.0, 0.5, 0.5);
        for (int i = 0; i < 200; i++) {
            tracker.registerAction("action_" + i, ResponsePattern.DAMPEN, before, 0.0);
        }

        List<FeedbackRecord> emitted = new ArrayList<>();
        StateVector changed = new StateVector(48.0, 0.5, 0.5);
        for (int tick = 1; tick <= 25; tick++) {
            emitted.addAll(tracker.observeConsequences(changed));
            for (PendingAction pending : tracker.getPendingActions()) {
                assertThat(pending.getTicksWaited()).isLessThanOrEqualTo(20);
            }
        }

        assertThat(emitted).hasSize(200);
        assertThat(emitted).allSatisfy(r -> assertThat(r.delayTicks()).isBetween(3, 20));
        assertThat(emitted).allSatisfy(r -> assertThat(r.delayTicks()).isBetween(3, 10));
        assertThat(tracker.getPendingCount()).isZero();
        assertThat(tracker.getEmittedCount()).isEqualTo(200);
    }

    @Test
    void suppressesChangesBelowNoiseFloor() {
        StateVector before = new StateVector(50.0, 0.5, 0.5);
        tracker.registerAction("quiet", ResponsePattern.ABSORB, before, 0.0, List.of(), 3);

        List<FeedbackRecord> emitted = new ArrayList<>();
        for (int tick = 0; tick < 3; tick++) {
            emitted.addAll(tracker.observeConsequences(new StateVector(50.0005, 0.5, 0.5)));
        }

        assertThat(emitted).isEmpty();
        assertThat(tracker.getPendingCount()).isZero();
        assertThat(tracker.getSuppressedCount()).isEqualTo(1);
    }

    @Test
    void dropsActionsThatOutliveTheTimeout() {
        StateVector before = new StateVector(50.0, 0.5, 0.5);
        tracker.restore(List.of(new PendingAction("stuck", ResponsePattern.ABSORB, before, 0.0, 30, List.of())));

        for (int tick = 0; tick < 21; tick++) {
            assertThat(tracker.observeConsequences(new StateVector(10.0, 0.5, 0.5))).isEmpty();
        }

        assertThat(tracker.isPending("stuck")).isFalse();
        assertThat(tracker.getTimedOutCount()).isEqualTo(1);
    }

    @Test
    void ignoresDuplicateRegistration() {
        StateVector before = new StateVector(50.0, 0.5, 0.5);

        assertThat(tracker.registerAction("dup", ResponsePattern.ABSORB, before, 0.0)).isTrue();
        assertThat(tracker.registerAction("dup", ResponsePattern.DAMPEN, before, 0.0)).isFalse();
        assertThat(tracker.getPendingActions()).singleElement()
            .extracting(PendingAction::getActionPattern).isEqualTo(ResponsePattern.ABSORB);
    }

    @Test
    void sameSeedProducesSameDelays() {
        FeedbackTracker other = new FeedbackTracker(new SeededRandomProvider(7L), FeedbackSettings.defaults(), CLOCK);
        StateVector before = new StateVector(50.0, 0.5, 0.5);
        for (int i = 0; i < 20; i++) {
            tracker.registerAction("x" + i, ResponsePattern.ABSORB, before, 0.0);
            other.registerAction("x" + i, ResponsePattern.ABSORB, before, 0.0);
        }

        assertThat(tracker.getPendingActions()).extracting(PendingAction::getCheckAfterTicks)
            .containsExactlyElementsOf(other.getPendingActions().stream().map(PendingAction::getCheckAfterTicks).toList());
    }
}
