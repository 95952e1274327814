package org.vivarium.runtime.learning;

import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.vivarium.runtime.model.BehaviourParameters;
import org.vivarium.runtime.model.MemoryEntry;
import org.vivarium.runtime.model.SelfState;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class LearningEngineTest {

    private LearningEngine learning;
    private SelfState state;

    @BeforeEach
    void setUp() {
        learning = new LearningEngine();
        state = new SelfState();
    }

    @Test
    void frequentTypesGainSensitivityAndRareTypesLoseIt() {
        remember("shock", 0.6, 8);
        remember("noise", 0.1, 2);

        BehaviourParameters learned = learning.learn(state);

        assertThat(learned.getSensitivity().get("shock")).isCloseTo(0.21, within(1e-9));
        assertThat(learned.getSensitivity().get("noise")).isCloseTo(0.2, within(1e-9));
        assertThat(learned.getSensitivity().get("recovery")).isCloseTo(0.19, within(1e-9));
        assertThat(state.getLearningParams()).isEqualTo(learned);
    }

    @Test
    void meanSignificanceMovesTheIgnoreThreshold() {
        remember("shock", 0.6, 8);
        remember("noise", 0.1, 2);

        BehaviourParameters learned = learning.learn(state);

        assertThat(learned.getThresholds().get("shock")).isCloseTo(0.09, within(1e-9));
        assertThat(learned.getThresholds().get("noise")).isCloseTo(0.11, within(1e-9));
        // Never seen
        assertThat(learned.getThresholds().get("decay")).isEqualTo(0.1);
    }

    @Test
    void feedbackFrequencyMovesResponseCoefficients() {
        for (int i = 0; i < 3; i++) {
            rememberFeedback("dampen");
        }
        rememberFeedback("absorb");

        BehaviourParameters learned = learning.learn(state);

        assertThat(learned.getCoefficients().get("dampen")).isCloseTo(0.51, within(1e-9));
        assertThat(learned.getCoefficients().get("absorb")).isEqualTo(1.0);
        assertThat(learned.getCoefficients().get("ignore")).isEqualTo(0.0);
        assertThat(learned.getSensitivity()).isEqualTo(BehaviourParameters.defaults().getSensitivity());
    }

    @Test
    void emptyMemoryLeavesParametersUnchanged() {
        assertThat(learning.learn(state)).isEqualTo(BehaviourParameters.defaults());
    }

    @Test
    void repeatedStepsStayWithinOneStepAndTheUnitRange() {
        remember("shock", 0.9, 5);

        for (int i = 0; i < 120; i++) {
            BehaviourParameters before = state.getLearningParams();
            BehaviourParameters after = learning.learn(state);
            assertBounded(before.getSensitivity(), after.getSensitivity());
            assertBounded(before.getThresholds(), after.getThresholds());
        }

        assertThat(state.getLearningParams().getSensitivity().get("shock")).isCloseTo(1.0, within(1e-9));
        assertThat(state.getLearningParams().getSensitivity().get("idle")).isCloseTo(0.0, within(1e-9));
        assertThat(state.getLearningParams().getThresholds().get("shock")).isCloseTo(0.0, within(1e-9));
    }

    private static void assertBounded(Map<String, Double> before, Map<String, Double> after) {
        after.forEach((key, value) -> {
            assertThat(value).isBetween(0.0, 1.0);
            assertThat(Math.abs(value - before.get(key))).isLessThanOrEqualTo(LearningEngine.MAX_STEP + 1e-12);
        });
    }

    private void remember(String type, double significance, int count) {
        for (int i = 0; i < count; i++) {
            state.getMemory().append(new MemoryEntry(type, significance, 1_700_000_000.0 + i, i));
        }
    }

    private void rememberFeedback(String pattern) {
        state.getMemory().append(new MemoryEntry(MemoryEntry.FEEDBACK_TYPE, 0.0, 1_700_000_000.0, 1.0, 0.0,
            Map.of(MemoryStatistics.ACTION_PATTERN_KEY, pattern)));
    }
}
