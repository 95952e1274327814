package org.vivarium.runtime;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.vivarium.runtime.model.SelfState;
import org.vivarium.runtime.model.StateVector;

import com.typesafe.config.ConfigFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class LifePolicyTest {

    private final LifePolicy policy = LifePolicy.defaults();

    @Test
    void healthyOrganismPaysNothing() {
        SelfState state = new SelfState();

        assertThat(policy.isWeak(state)).isFalse();
        assertThat(policy.penalty(state, 1.0).maxAbsComponent()).isZero();
    }

    @Test
    void penaltyGrowsWithTheDeficitAndTheTimeStep() {
        SelfState state = new SelfState();
        state.setStability(0.01);
        state.setIntegrity(0.03);

        StateVector penalty = policy.penalty(state, 2.0);

        double total = 0.02 * 2.0 * (2.0 * 0.04 + 2.0 * 0.02);
        assertThat(penalty.energy()).isCloseTo(-total * 0.2, within(1e-12));
        assertThat(penalty.stability()).isCloseTo(-total * 0.4, within(1e-12));
        assertThat(penalty.integrity()).isCloseTo(-total * 0.4, within(1e-12));
    }

    @Test
    void lowEnergyAloneIsWeakButCostsNothing() {
        SelfState state = new SelfState();
        state.setEnergy(4.0);

        assertThat(policy.isWeak(state)).isTrue();
        assertThat(policy.penalty(state, 1.0).maxAbsComponent()).isZero();
    }

    @Test
    void disabledPolicyNeverPenalizes() {
        LifePolicy disabled = LifePolicy.fromConfig(ConfigFactory.parseString("enabled = false"));
        SelfState state = new SelfState();
        state.setStability(0.0);

        assertThat(disabled.penalty(state, 1.0).maxAbsComponent()).isZero();
    }

    @Test
    void readsOverridesAndRejectsNegativeValues() {
        LifePolicy custom = LifePolicy.fromConfig(ConfigFactory.parseString("threshold = 0.2, penaltyK = 0.1"));

        assertThat(custom.weaknessThreshold()).isEqualTo(0.2);
        assertThat(custom.penaltyK()).isEqualTo(0.1);
        assertThat(custom.stabilityMultiplier()).isEqualTo(2.0);
        assertThatThrownBy(() -> new LifePolicy(true, -0.1, 0.02, 2.0, 2.0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
