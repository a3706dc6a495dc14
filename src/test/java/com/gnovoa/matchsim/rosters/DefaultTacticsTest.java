package com.gnovoa.matchsim.rosters;

import static org.assertj.core.api.Assertions.assertThat;

import com.gnovoa.matchsim.TestRosters;
import com.gnovoa.matchsim.config.SimProperties;
import com.gnovoa.matchsim.core.TacticsValidator;
import com.gnovoa.matchsim.model.Formation;
import com.gnovoa.matchsim.model.Position;
import com.gnovoa.matchsim.model.Posture;
import com.gnovoa.matchsim.model.Tactics;
import com.gnovoa.matchsim.model.Team;
import com.gnovoa.matchsim.sim.AttributeModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DefaultTacticsTest {

  private final DefaultTactics defaults =
      new DefaultTactics(new AttributeModel(SimProperties.defaults()));
  private final TacticsValidator validator = new TacticsValidator();

  @Test
  @DisplayName("Should pick a valid lineup for every supported formation")
  void validForEveryFormation() {
    Team team = TestRosters.team("t", 70);
    for (Formation formation : Formation.values()) {
      Tactics tactics = defaults.pick(team, formation, Posture.BALANCED);

      assertThat(validator.validate(team, tactics)).isEqualTo(formation);
      assertThat(tactics.substitutes()).hasSize(DefaultTactics.BENCH_SIZE);
    }
  }

  @Test
  @DisplayName("Should start the best keeper and keep the other one on the bench")
  void bestKeeperStarts() {
    Team team =
        TestRosters.withPlayer(
            TestRosters.team("t", 70), TestRosters.player(TestRosters.id("t", 2), Position.GK, 85));

    Tactics tactics = defaults.pick(team);

    assertThat(tactics.formation()).isEqualTo("4-3-3");
    assertThat(tactics.posture()).isEqualTo(Posture.BALANCED);
    assertThat(tactics.lineup()).contains(TestRosters.id("t", 2)).doesNotContain(TestRosters.id("t", 1));
    assertThat(tactics.substitutes()).contains(TestRosters.id("t", 1));
  }

  @Test
  @DisplayName("Should prefer stronger players within a line")
  void strongestPerLine() {
    Team team =
        TestRosters.withPlayer(
            TestRosters.team("t", 70), TestRosters.player(TestRosters.id("t", 18), Position.ATT, 90));

    assertThat(defaults.pick(team).lineup()).contains(TestRosters.id("t", 18));
  }
}
