package com.gnovoa.matchsim.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.gnovoa.matchsim.TestRosters;
import com.gnovoa.matchsim.model.Formation;
import com.gnovoa.matchsim.model.Posture;
import com.gnovoa.matchsim.model.Tactics;
import com.gnovoa.matchsim.model.Team;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TacticsValidatorTest {

    private final TacticsValidator validator = new TacticsValidator();
    private final Team team = TestRosters.team("t", 70);

    @Test
    @DisplayName("A complete 4-3-3 with one goalkeeper is accepted")
    void validTactics() {
        assertThat(validator.validate(team, TestRosters.tactics433(team))).isEqualTo(Formation.F_4_3_3);
    }

    @Test
    @DisplayName("Lineups must have exactly eleven players")
    void lineupSize() {
        Tactics ten = tactics(TestRosters.ids("t", 1, 3, 4, 5, 6, 9, 10, 11, 15, 16), List.of());

        assertThatThrownBy(() -> validator.validate(team, ten))
                .isInstanceOf(MatchSetupException.class)
                .hasMessageContaining("expected 11");
    }

    @Test
    @DisplayName("Exactly one goalkeeper must start")
    void goalkeeperCount() {
        Tactics twoKeepers = tactics(TestRosters.ids("t", 1, 2, 4, 5, 6, 9, 10, 11, 15, 16, 17), List.of());
        Tactics noKeeper = tactics(TestRosters.ids("t", 3, 18, 4, 5, 6, 9, 10, 11, 15, 16, 17), List.of());

        assertThatThrownBy(() -> validator.validate(team, twoKeepers)).hasMessageContaining("2 goalkeepers");
        assertThatThrownBy(() -> validator.validate(team, noKeeper)).hasMessageContaining("0 goalkeepers");
    }

    @Test
    @DisplayName("Unknown and duplicated player ids are rejected")
    void unknownAndDuplicateIds() {
        List<String> unknown = new ArrayList<>(TestRosters.tactics433(team).lineup());
        unknown.set(10, "someone-else");
        List<String> duplicate = new ArrayList<>(TestRosters.tactics433(team).lineup());
        duplicate.set(10, duplicate.get(9));

        assertThatThrownBy(() -> validator.validate(team, tactics(unknown, List.of())))
                .isInstanceOf(MatchSetupException.class)
                .hasMessageContaining("Unknown player someone-else");
        assertThatThrownBy(() -> validator.validate(team, tactics(duplicate, List.of())))
                .isInstanceOf(MatchSetupException.class)
                .hasMessageContaining("appears twice");
    }

    @Test
    @DisplayName("A starter cannot also sit on the bench")
    void benchOverlap() {
        Tactics overlap = tactics(TestRosters.tactics433(team).lineup(), TestRosters.ids("t", 2, 15));

        assertThatThrownBy(() -> validator.validate(team, overlap)).hasMessageContaining("both starting and on the bench");
    }

    @Test
    @DisplayName("Unknown formations and missing tactics are setup errors")
    void formationAndMissingTactics() {
        Tactics oddShape = new Tactics("2-3-5", Posture.ATTACKING, TestRosters.tactics433(team).lineup(), List.of());

        assertThatThrownBy(() -> validator.validate(team, oddShape)).isInstanceOf(MatchSetupException.class)
                .hasMessageContaining("Unknown formation");
        assertThatThrownBy(() -> validator.validate(team, null)).isInstanceOf(MatchSetupException.class);
    }

    private static Tactics tactics(List<String> lineup, List<String> bench) {
        return new Tactics("4-3-3", Posture.BALANCED, lineup, bench);
    }
}
