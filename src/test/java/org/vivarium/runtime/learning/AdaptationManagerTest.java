package org.vivarium.runtime.learning;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.vivarium.runtime.model.BehaviourParameters;
import org.vivarium.runtime.model.SelfState;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.assertj.core.api.InstanceOfAssertFactories.MAP;

@Tag("unit")
class AdaptationManagerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochSecond(1_700_000_000L), ZoneOffset.UTC);

    private AdaptationManager adaptation;
    private SelfState state;

    @BeforeEach
    void setUp() {
        adaptation = new AdaptationManager(CLOCK);
        state = new SelfState();
    }

    @Test
    void movesTowardsLearnedValuesByOneStepAndRecordsIt() {
        learnShockSensitivity(0.5);

        Map<String, Object> changes = adaptation.adapt(state);

        assertThat(state.getAdaptationParams().getSensitivity().get("shock")).isCloseTo(0.21, within(1e-9));
        assertThat(changes).containsOnlyKeys(BehaviourParameters.SENSITIVITY);
        assertThat(state.getAdaptationHistory()).singleElement().satisfies(record -> {
            assertThat(record)
                .containsEntry("type", AdaptationManager.RECORD_TYPE)
                .containsEntry("timestamp", 1_700_000_000.0)
                .containsEntry("tick", 0L)
                .containsEntry("old_params", BehaviourParameters.defaults().toMap())
                .containsEntry("learning_params_snapshot", state.getLearningParams().toMap());
            assertThat(record.get("changes")).asInstanceOf(MAP)
                .extractingByKey(BehaviourParameters.SENSITIVITY).asInstanceOf(MAP)
                .extractingByKey("shock").asInstanceOf(MAP)
                .containsEntry("old", 0.2)
                .hasEntrySatisfying("delta", delta -> assertThat((Double) delta).isCloseTo(0.01, within(1e-9)));
        });
    }

    @Test
    void smallGapIsClosedExactly() {
        learnShockSensitivity(0.205);

        adaptation.adapt(state);

        assertThat(state.getAdaptationParams().getSensitivity().get("shock")).isCloseTo(0.205, within(1e-12));
    }

    @Test
    void nothingToAdaptRecordsNothing() {
        assertThat(adaptation.adapt(state)).isEmpty();
        assertThat(state.getAdaptationHistory()).isEmpty();
        assertThat(state.getAdaptationParams()).isEqualTo(BehaviourParameters.defaults());
    }

    @Test
    void repeatedStepsConvergeWithoutEverExceedingOneStep() {
        learnShockSensitivity(0.5);

        for (int i = 0; i < 40; i++) {
            double before = state.getAdaptationParams().getSensitivity().get("shock");
            adaptation.adapt(state);
            double after = state.getAdaptationParams().getSensitivity().get("shock");
            assertThat(after - before).isBetween(0.0, AdaptationManager.MAX_STEP + 1e-12);
        }

        assertThat(state.getAdaptationParams().getSensitivity().get("shock")).isCloseTo(0.5, within(1e-9));
        assertThat(state.getAdaptationHistory()).hasSizeLessThanOrEqualTo(31);
    }

    private void learnShockSensitivity(double value) {
        BehaviourParameters d = BehaviourParameters.defaults();
        Map<String, Double> sensitivity = new HashMap<>(d.getSensitivity());
        sensitivity.put("shock", value);
        state.setLearningParams(new BehaviourParameters(sensitivity, d.getThresholds(), d.getCoefficients()));
    }
}
