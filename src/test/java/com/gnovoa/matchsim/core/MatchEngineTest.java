package com.gnovoa.matchsim.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.gnovoa.matchsim.TestRosters;
import com.gnovoa.matchsim.events.MatchEvent;
import com.gnovoa.matchsim.events.MatchEventType;
import com.gnovoa.matchsim.model.Control;
import com.gnovoa.matchsim.model.Player;
import com.gnovoa.matchsim.model.Position;
import com.gnovoa.matchsim.model.Team;
import com.gnovoa.matchsim.model.TeamSide;
import com.gnovoa.matchsim.trace.AiTraceEvent;
import com.gnovoa.matchsim.trace.AiTraceType;
import com.gnovoa.matchsim.trace.InMemoryTraceRecorder;
import com.gnovoa.matchsim.trace.TraceQuery;
import com.gnovoa.matchsim.trace.TraceRecorder;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MatchEngineTest {

    @Test
    @DisplayName("Same seed and setup replay the exact same match")
    void deterministicReplay() {
        MatchEngine first = TestMatches.engine(TestMatches.aiSetup(2024), TraceRecorder.disabled());
        MatchEngine second = TestMatches.engine(TestMatches.aiSetup(2024), TraceRecorder.disabled());

        first.simulateToEnd();
        second.simulateToEnd();

        assertThat(second.events()).isEqualTo(first.events());
        assertThat(second.snapshot()).isEqualTo(first.snapshot());
    }

    @Test
    @DisplayName("Different seeds produce different matches")
    void seedsMatter() {
        Set<List<MatchEvent>> logs = new HashSet<>();
        for (long seed = 1; seed <= 5; seed++) {
            MatchEngine engine = TestMatches.engine(TestMatches.aiSetup(seed), TraceRecorder.disabled());
            engine.simulateToEnd();
            logs.add(engine.events());
        }
        assertThat(logs).hasSizeGreaterThan(1);
    }

    @Test
    @DisplayName("Two default 4-3-3 sides play to a single full-time whistle at minute 90")
    void fullMatchClock() {
        MatchEngine engine = TestMatches.engine(TestMatches.aiSetup(99), TraceRecorder.disabled());
        MatchState state = TestMatches.state(engine);

        engine.simulateToEnd();
        List<MatchEvent> events = engine.events();

        assertThat(state.home().startingLineup()).hasSize(11);
        assertThat(state.away().startingLineup()).hasSize(11);
        assertThat(events.get(0).type()).isEqualTo(MatchEventType.KICKOFF);
        assertThat(events).filteredOn(e -> e.type() == MatchEventType.HALF_TIME)
                .singleElement().satisfies(e -> assertThat(e.minute()).isEqualTo(45));

        MatchEvent last = events.get(events.size() - 1);
        assertThat(events).filteredOn(e -> e.type() == MatchEventType.FULL_TIME).containsExactly(last);
        assertThat(last.minute()).isEqualTo(90);
        assertThat(last.addedTime()).isEqualTo(state.stoppageMinutes()).isBetween(1, 5);
        assertThat(engine.isFinished()).isTrue();
        assertThat(engine.phase()).isEqualTo(MatchPhase.FULL_TIME);
    }

    @Test
    @DisplayName("Ticks after full time change nothing")
    void ticksAfterFullTimeAreNoOps() {
        MatchEngine engine = TestMatches.engine(TestMatches.aiSetup(5), TraceRecorder.disabled());
        engine.simulateToEnd();
        MatchSnapshot before = engine.snapshot();

        assertThat(engine.tick()).isFalse();
        assertThat(engine.advance(10)).isZero();
        assertThat(engine.snapshot()).isEqualTo(before);
    }

    @Test
    @DisplayName("advance(n) plays n minutes, kickoff included in the first")
    void advance() {
        MatchEngine engine = TestMatches.engine(TestMatches.aiSetup(8), TraceRecorder.disabled());

        assertThat(engine.advance(10)).isEqualTo(10);
        assertThat(engine.snapshot().minute()).isEqualTo(10);
        assertThat(engine.phase()).isEqualTo(MatchPhase.FIRST_HALF);

        assertThat(engine.advance(35)).isEqualTo(35);
        assertThat(engine.phase()).isEqualTo(MatchPhase.HALF_TIME);

        engine.tick();
        assertThat(engine.phase()).isEqualTo(MatchPhase.SECOND_HALF);
    }

    @Test
    @DisplayName("Match invariants hold across many seeds")
    void invariantsAcrossSeeds() {
        for (long seed = 1; seed <= 150; seed++) {
            MatchEngine engine = TestMatches.engine(TestMatches.aiSetup(seed), TraceRecorder.disabled());
            MatchState state = TestMatches.state(engine);
            engine.simulateToEnd();
            List<MatchEvent> events = engine.events();

            for (int i = 1; i < events.size(); i++) {
                assertThat(MatchEvent.CHRONOLOGICAL.compare(events.get(i - 1), events.get(i))).isLessThanOrEqualTo(0);
            }

            Map<String, Long> yellows = countByPlayer(events, MatchEventType.YELLOW_CARD);
            Map<String, Long> reds = countByPlayer(events, MatchEventType.RED_CARD);
            assertThat(yellows.values()).allMatch(n -> n == 1);
            assertThat(reds.values()).allMatch(n -> n == 1);

            for (TeamState team : List.of(state.home(), state.away())) {
                assertThat(team.subsUsed()).isLessThanOrEqualTo(5);
                assertThat(team.energy().values()).allMatch(e -> e >= 0 && e <= 100);
            }
            for (MatchEvent red : events) {
                if (red.type() != MatchEventType.RED_CARD) continue;
                assertThat(state.side(red.team()).isSentOff(red.playerId())).isTrue();
                assertThat(state.side(red.team()).bookingsOf(red.playerId())).isEqualTo(2);
            }

            assertThat(events).filteredOn(e -> e.type() == MatchEventType.SUBSTITUTION).allSatisfy(e -> {
                assertThat(e.minute()).isGreaterThanOrEqualTo(46);
                assertThat(e.description()).contains("[ai_reason:");
            });

            long homeGoals = events.stream().filter(e -> e.type().isScoring() && e.team() == TeamSide.HOME).count();
            long awayGoals = events.stream().filter(e -> e.type().isScoring() && e.team() == TeamSide.AWAY).count();
            assertThat(engine.snapshot().homeScore()).isEqualTo((int) homeGoals);
            assertThat(engine.snapshot().awayScore()).isEqualTo((int) awayGoals);
        }
    }

    @Test
    @DisplayName("A sent-off player takes no further part")
    void dismissedPlayersDisappear() {
        for (long seed = 1; seed <= 150; seed++) {
            MatchEngine engine = TestMatches.engine(TestMatches.aiSetup(seed), TraceRecorder.disabled());
            engine.simulateToEnd();
            List<MatchEvent> events = engine.events();

            Set<String> dismissed = new HashSet<>();
            for (MatchEvent e : events) {
                if (e.playerId() != null) assertThat(dismissed).doesNotContain(e.playerId());
                if (e.assistPlayerId() != null) assertThat(dismissed).doesNotContain(e.assistPlayerId());
                if (e.type() == MatchEventType.RED_CARD) dismissed.add(e.playerId());
            }
        }
    }

    @Test
    @DisplayName("Live energy never rises from one minute to the next")
    void energyIsMonotonic() {
        MatchEngine engine = TestMatches.engine(TestMatches.aiSetup(31), TraceRecorder.disabled());
        MatchState state = TestMatches.state(engine);
        Map<String, Double> previous = new HashMap<>();

        while (engine.tick()) {
            for (TeamState team : List.of(state.home(), state.away())) {
                team.energy().forEach((id, energy) -> {
                    String key = team.side() + ":" + id;
                    Double before = previous.get(key);
                    if (before != null) assertThat(energy).isLessThanOrEqualTo(before);
                    assertThat(energy).isBetween(0.0, 100.0);
                    previous.put(key, energy);
                });
            }
        }
    }

    @Test
    @DisplayName("Tracing on or off yields identical event logs")
    void tracingIsASideChannel() {
        InMemoryTraceRecorder trace = new InMemoryTraceRecorder(100_000);
        MatchEngine traced = TestMatches.engine(TestMatches.aiSetup(77), trace);
        MatchEngine plain = TestMatches.engine(TestMatches.aiSetup(77), TraceRecorder.disabled());

        traced.simulateToEnd();
        plain.simulateToEnd();

        assertThat(traced.events()).isEqualTo(plain.events());
        int minutes = TestMatches.state(traced).minute();
        assertThat(trace.countsByType().get(AiTraceType.MINUTE_CONTEXT)).isEqualTo(minutes);
        assertThat(trace.countsByType().get(AiTraceType.ENERGY_TICK)).isEqualTo(2 * minutes);
        assertThat(trace.dropped()).isZero();
    }

    @Test
    @DisplayName("Human-controlled sides never receive AI substitutions")
    void humanSidesAreLeftAlone() {
        for (long seed = 1; seed <= 60; seed++) {
            MatchEngine engine = TestMatches.engine(TestMatches.setup(seed, Control.HUMAN, Control.AI), TraceRecorder.disabled());
            engine.simulateToEnd();

            assertThat(engine.events())
                    .filteredOn(e -> e.type() == MatchEventType.SUBSTITUTION)
                    .allSatisfy(e -> assertThat(e.team()).isEqualTo(TeamSide.AWAY));
            assertThat(engine.snapshot().home().subsUsed()).isZero();
        }
    }

    @Test
    @DisplayName("An exhausted AI player is replaced within the minute and the trace carries both energies")
    void fatigueSubstitutionIsExecuted() {
        InMemoryTraceRecorder recorder = new InMemoryTraceRecorder(5000);
        MatchEngine engine = TestMatches.engine(TestMatches.aiSetup(31), recorder);
        engine.advance(60);
        TeamState home = TestMatches.state(engine).home();
        Player tired = home.onPitch().stream()
                .filter(p -> p.position() == Position.MID)
                .findFirst()
                .orElseThrow();
        TestMatches.setEnergy(home, tired.playerId(), 20);

        engine.tick();

        List<AiTraceEvent> executed = recorder.query(new TraceQuery(61, TeamSide.HOME, AiTraceType.SUB_EXECUTED));
        assertThat(executed).isNotEmpty();
        AiTraceEvent sub = executed.get(0);
        assertThat(sub.inputs()).containsEntry("outgoing", tired.playerId());
        assertThat(sub.outcome()).containsEntry("reason", "fatigue");
        double outgoing = (Double) sub.computed().get("outgoingEnergy");
        double incoming = (Double) sub.computed().get("incomingEnergy");
        assertThat(outgoing).isLessThanOrEqualTo(20.0);
        assertThat(incoming - outgoing).isGreaterThanOrEqualTo(20.0);
        assertThat(home.onPitch()).doesNotContain(tired);
    }

    @Test
    @DisplayName("Manual substitutions are only accepted for human sides during the match")
    void manualSubstitutionGuards() {
        MatchEngine engine = TestMatches.engine(TestMatches.setup(12, Control.HUMAN, Control.AI), TraceRecorder.disabled());
        String striker = TestRosters.id("home", 15);
        String benchStriker = TestRosters.id("home", 18);

        assertThatThrownBy(() -> engine.substitute(TeamSide.HOME, striker, benchStriker))
                .isInstanceOf(SubstitutionRejectedException.class)
                .hasMessageContaining("scheduled");
        assertThatThrownBy(() -> engine.substitute(TeamSide.AWAY, TestRosters.id("away", 15), TestRosters.id("away", 18)))
                .isInstanceOf(SubstitutionRejectedException.class)
                .hasMessageContaining("AI-controlled");

        engine.simulateToEnd();
        assertThatThrownBy(() -> engine.substitute(TeamSide.HOME, striker, benchStriker))
                .isInstanceOf(SubstitutionRejectedException.class)
                .hasMessageContaining("full_time");
    }

    @Test
    @DisplayName("A human side can make a like-for-like change at half time")
    void manualSubstitutionAtHalfTime() {
        MatchEngine engine = TestMatches.engine(TestMatches.setup(12, Control.HUMAN, Control.AI), TraceRecorder.disabled());
        MatchState state = TestMatches.state(engine);
        engine.advance(45);
        assertThat(engine.phase()).isEqualTo(MatchPhase.HALF_TIME);

        Player out = state.home().onPitch().stream().filter(p -> p.position() == Position.ATT).findFirst().orElseThrow();
        Player defender = state.home().onPitch().stream().filter(p -> p.position() == Position.DEF).findFirst().orElseThrow();
        String in = TestRosters.id("home", 18);

        assertThatThrownBy(() -> engine.substitute(TeamSide.HOME, defender.playerId(), in))
                .isInstanceOf(SubstitutionRejectedException.class)
                .hasMessageContaining("different position");

        MatchEvent event = engine.substitute(TeamSide.HOME, out.playerId(), in);

        assertThat(event.type()).isEqualTo(MatchEventType.SUBSTITUTION);
        assertThat(event.team()).isEqualTo(TeamSide.HOME);
        assertThat(event.playerId()).isEqualTo(in);
        assertThat(event.assistPlayerId()).isEqualTo(out.playerId());
        assertThat(event.minute()).isEqualTo(45);
        assertThat(event.description()).doesNotContain("[ai_reason:");
        assertThat(engine.snapshot().home().subsUsed()).isEqualTo(1);
        assertThat(state.home().isOnPitch(in)).isTrue();

        assertThatThrownBy(() -> engine.substitute(TeamSide.HOME, out.playerId(), in))
                .isInstanceOf(SubstitutionRejectedException.class);
    }

    @Test
    @DisplayName("Setup errors surface before kickoff")
    void setupErrors() {
        Team home = TestRosters.team("home", 70);
        MatchSetup selfMatch = MatchSetup.aiVsAi("m-x", home, home, TestRosters.tactics433(home), TestRosters.tactics433(home), 1);
        MatchSetup noTactics = MatchSetup.aiVsAi("m-y", home, TestRosters.team("away", 70), TestRosters.tactics433(home), null, 1);

        assertThatThrownBy(() -> TestMatches.engine(selfMatch, null)).isInstanceOf(MatchSetupException.class);
        assertThatThrownBy(() -> TestMatches.engine(noTactics, null)).isInstanceOf(MatchSetupException.class);
    }

    private static Map<String, Long> countByPlayer(List<MatchEvent> events, MatchEventType type) {
        return events.stream()
                .filter(e -> e.type() == type)
                .collect(Collectors.groupingBy(e -> e.team() + ":" + e.playerId(), Collectors.counting()));
    }
}
