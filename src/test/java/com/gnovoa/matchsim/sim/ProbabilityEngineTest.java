package com.gnovoa.matchsim.sim;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.gnovoa.matchsim.TestRosters;
import com.gnovoa.matchsim.core.MatchState;
import com.gnovoa.matchsim.core.TeamState;
import com.gnovoa.matchsim.core.TestMatches;
import com.gnovoa.matchsim.events.MatchEvent;
import com.gnovoa.matchsim.events.MatchEventType;
import com.gnovoa.matchsim.model.Player;
import com.gnovoa.matchsim.model.TeamSide;
import com.gnovoa.matchsim.trace.AiTraceType;
import com.gnovoa.matchsim.trace.InMemoryTraceRecorder;
import com.gnovoa.matchsim.trace.TraceRecorder;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ProbabilityEngineTest {

    private final ProbabilityEngine engine = TestMatches.MODELS.probability();

    private TeamState home;
    private TeamState away;
    private MatchState state;

    @BeforeEach
    void setUp() {
        home = TestMatches.teamState(TeamSide.HOME, TestRosters.team("home", 72));
        away = TestMatches.teamState(TeamSide.AWAY, TestRosters.team("away", 72));
        state = TestMatches.matchState(home, away);
        TestMatches.clockTo(state, 30);
    }

    @Test
    @DisplayName("Home advantage shifts possession unless the venue is neutral")
    void possessionShare() {
        MatchState neutral = TestMatches.matchState(home, away, true);

        assertThat(engine.homePossessionShare(state)).isCloseTo(0.54, within(1e-9));
        assertThat(engine.homePossessionShare(neutral)).isCloseTo(0.5, within(1e-9));
    }

    @Test
    @DisplayName("Possession share stays inside the configured band for lopsided teams")
    void possessionBand() {
        TeamState giants = TestMatches.teamState(TeamSide.HOME, TestRosters.team("home", 99));
        TeamState minnows = TestMatches.teamState(TeamSide.AWAY, TestRosters.team("away", 5));

        assertThat(engine.homePossessionShare(TestMatches.matchState(giants, minnows))).isEqualTo(0.8);
        assertThat(engine.homePossessionShare(TestMatches.matchState(minnows, giants))).isEqualTo(0.2);
    }

    @Test
    @DisplayName("A quiet minute consumes only the trigger draw")
    void quietMinute() {
        ScriptedRandomSource rnd = new ScriptedRandomSource(0.99);
        InMemoryTraceRecorder trace = new InMemoryTraceRecorder();

        assertThat(engine.rollMinute(state, rnd, trace)).isEmpty();
        assertThat(rnd.consumed()).isEqualTo(1);
        assertThat(trace.events()).singleElement()
                .satisfies(e -> assertThat(e.type()).isEqualTo(AiTraceType.EVENT_PROBABILITY));
    }

    @Test
    @DisplayName("Every rolled event names the right side and a player who is actually involved")
    void eventsAreWellFormed() {
        SeededRandomSource rnd = new SeededRandomSource(7);
        Set<MatchEventType> seen = EnumSet.noneOf(MatchEventType.class);
        String homeKeeper = home.goalkeeper().map(Player::playerId).orElseThrow();
        String awayKeeper = away.goalkeeper().map(Player::playerId).orElseThrow();

        for (int i = 0; i < 5000; i++) {
            TeamSide acting = i % 2 == 0 ? TeamSide.HOME : TeamSide.AWAY;
            TestMatches.possession(state, acting);
            TeamState attack = state.side(acting);
            TeamState defend = state.side(acting.opposite());

            Optional<EventOutcome> outcome = engine.rollMinute(state, rnd, TraceRecorder.disabled());
            if (outcome.isEmpty()) continue;
            List<MatchEvent> events = outcome.get().events();
            assertThat(events).isNotEmpty().allSatisfy(e -> {
                assertThat(e.minute()).isEqualTo(30);
                assertThat(e.addedTime()).isZero();
            });

            for (MatchEvent e : events) {
                seen.add(e.type());
                switch (e.type()) {
                    case GOAL, PENALTY_SCORED, PENALTY_MISSED, CHANCE_MISSED, OFFSIDE -> {
                        assertThat(e.team()).isEqualTo(acting);
                        assertThat(attack.isOnPitch(e.playerId())).isTrue();
                    }
                    case OWN_GOAL -> {
                        assertThat(e.team()).isEqualTo(acting);
                        assertThat(defend.isOnPitch(e.playerId())).isTrue();
                    }
                    case SAVE -> {
                        assertThat(e.team()).isEqualTo(acting.opposite());
                        assertThat(e.playerId()).isEqualTo(acting == TeamSide.HOME ? awayKeeper : homeKeeper);
                    }
                    case YELLOW_CARD, RED_CARD -> {
                        assertThat(e.team()).isEqualTo(acting.opposite());
                        assertThat(events.get(0).type()).isEqualTo(MatchEventType.FREE_KICK);
                    }
                    case CORNER, FREE_KICK -> assertThat(e.team()).isEqualTo(acting);
                    case INJURY -> assertThat(outcome.get().injuredPlayerId()).isEqualTo(e.playerId());
                    default -> throw new AssertionError("unexpected event " + e.type());
                }
            }
        }

        assertThat(seen).contains(MatchEventType.GOAL, MatchEventType.SAVE, MatchEventType.YELLOW_CARD,
                MatchEventType.CORNER, MatchEventType.CHANCE_MISSED);
    }

    @Test
    @DisplayName("Chance evaluations report both the raw and the clamped probability")
    void chanceTrace() {
        SeededRandomSource rnd = new SeededRandomSource(11);
        InMemoryTraceRecorder trace = new InMemoryTraceRecorder(50_000);
        for (int i = 0; i < 2000; i++) engine.rollMinute(state, rnd, trace);

        var chances = trace.events().stream().filter(e -> e.type() == AiTraceType.CHANCE_EVALUATION).toList();
        assertThat(chances).isNotEmpty().allSatisfy(e -> {
            assertThat(e.computed()).containsKeys("rawProbability", "clampedProbability");
            assertThat((Double) e.computed().get("clampedProbability")).isBetween(0.0, 1.0);
        });
    }
}
