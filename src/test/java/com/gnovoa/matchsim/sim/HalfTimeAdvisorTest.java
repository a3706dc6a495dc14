package com.gnovoa.matchsim.sim;

import static org.assertj.core.api.Assertions.assertThat;

import com.gnovoa.matchsim.model.Formation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class HalfTimeAdvisorTest {

    private final HalfTimeAdvisor advisor = new HalfTimeAdvisor();

    @Test
    @DisplayName("Situation and goal difference follow the half-time score")
    void situation() {
        assertThat(advisor.hints(2, 0, Formation.F_4_3_3, Formation.F_4_3_3).situation())
                .isEqualTo(HalfTimeAdvisor.Situation.WINNING);
        assertThat(advisor.hints(1, 1, Formation.F_4_3_3, Formation.F_4_3_3).situation())
                .isEqualTo(HalfTimeAdvisor.Situation.DRAWING);

        HalfTimeAdvisor.HalfTimeHints losing = advisor.hints(0, 3, Formation.F_4_3_3, Formation.F_4_3_3);
        assertThat(losing.situation()).isEqualTo(HalfTimeAdvisor.Situation.LOSING);
        assertThat(losing.goalDifference()).isEqualTo(3);
    }

    @Test
    @DisplayName("Posture hints are qualitative only")
    void postureHints() {
        HalfTimeAdvisor.HalfTimeHints hints = advisor.hints(0, 0, Formation.F_4_4_2, Formation.F_4_4_2);

        assertThat(hints.postureHints())
                .containsEntry("defensive", "increases_prevention")
                .containsEntry("balanced", "neutral")
                .containsEntry("attacking", "increases_creation");
    }

    @Test
    @DisplayName("Small matchup effects read as neutral")
    void neutralMatchup() {
        assertThat(advisor.hints(0, 0, Formation.F_4_3_3, Formation.F_4_3_3).formationMatchupHints())
                .containsExactly("neutral");
    }

    @Test
    @DisplayName("A deep back five blunts the attack but secures the defence")
    void bucketedMatchup() {
        assertThat(advisor.hints(0, 0, Formation.F_4_3_3, Formation.F_5_4_1).formationMatchupHints())
                .containsExactly("attack_under_pressure", "defence_favourable");
    }
}
