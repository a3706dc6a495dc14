package com.gnovoa.matchsim.sim;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.gnovoa.matchsim.TestRosters;
import com.gnovoa.matchsim.config.SimProperties;
import com.gnovoa.matchsim.core.MatchState;
import com.gnovoa.matchsim.core.TeamState;
import com.gnovoa.matchsim.core.TestMatches;
import com.gnovoa.matchsim.events.MatchEvent;
import com.gnovoa.matchsim.events.MatchEventType;
import com.gnovoa.matchsim.model.Player;
import com.gnovoa.matchsim.model.PlayerAttributes;
import com.gnovoa.matchsim.model.Position;
import com.gnovoa.matchsim.model.Team;
import com.gnovoa.matchsim.model.TeamSide;
import com.gnovoa.matchsim.trace.AiTraceType;
import com.gnovoa.matchsim.trace.InMemoryTraceRecorder;
import com.gnovoa.matchsim.trace.TraceRecorder;
import com.gnovoa.matchsim.trace.TraceSeverity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DisciplineModelTest {

    private final AttributeModel attributes = new AttributeModel(SimProperties.defaults());
    private final DisciplineModel discipline = new DisciplineModel(attributes, SimProperties.Discipline.defaults());

    private Team home;
    private TeamState defending;

    @BeforeEach
    void setUp() {
        home = TestRosters.team("home", 70);
        defending = TestMatches.teamState(TeamSide.HOME, home);
    }

    @Test
    @DisplayName("A booked player drawn again always gets a second yellow, with no extra draw")
    void bookedPlayerIsSentOff() {
        String first = TestRosters.id("home", 1);
        TestMatches.book(defending, first);
        ScriptedRandomSource rnd = new ScriptedRandomSource(0.0);

        DisciplineModel.Foul foul = discipline.maybeFoul(defending, 60, rnd, TraceRecorder.disabled()).orElseThrow();

        assertThat(foul.player().playerId()).isEqualTo(first);
        assertThat(foul.severity()).isEqualTo(CardSeverity.SECOND_YELLOW);
        assertThat(foul.severity().dismisses()).isTrue();
        assertThat(rnd.consumed()).isEqualTo(1);
    }

    @Test
    @DisplayName("A second booking becomes a red card: sent off, never a standalone second yellow")
    void secondBookingIsRed() {
        TeamState away = TestMatches.teamState(TeamSide.AWAY, TestRosters.team("away", 70));
        MatchState state = TestMatches.matchState(defending, away);
        TestMatches.clockTo(state, 30);
        String player = TestRosters.id("home", 4);

        appendCard(state, MatchEventType.YELLOW_CARD, player);
        assertThat(defending.bookingsOf(player)).isEqualTo(1);

        assertThatThrownBy(() -> appendCard(state, MatchEventType.YELLOW_CARD, player))
                .isInstanceOf(IllegalStateException.class);

        appendCard(state, MatchEventType.RED_CARD, player);
        assertThat(defending.isSentOff(player)).isTrue();
        assertThat(defending.bookingsOf(player)).isEqualTo(2);
        assertThat(defending.isOnPitch(player)).isFalse();
    }

    @Test
    @DisplayName("An unbooked fouler gets a yellow unless the direct-red draw hits")
    void unbookedFouler() {
        var yellow = discipline.maybeFoul(defending, 20, new ScriptedRandomSource(0.0, 0.999), TraceRecorder.disabled());
        var red = discipline.maybeFoul(defending, 20, new ScriptedRandomSource(0.0, 0.0), TraceRecorder.disabled());

        assertThat(yellow.orElseThrow().severity()).isEqualTo(CardSeverity.YELLOW);
        assertThat(red.orElseThrow().severity()).isEqualTo(CardSeverity.DIRECT_RED);
    }

    @Test
    @DisplayName("A side with nobody left on the pitch yields no foul and consumes nothing")
    void noEligibleFouler() {
        for (String id : defending.startingLineup()) TestMatches.sendOff(defending, id);
        ScriptedRandomSource rnd = new ScriptedRandomSource();

        assertThat(discipline.maybeFoul(defending, 70, rnd, TraceRecorder.disabled())).isEmpty();
        assertThat(rnd.consumed()).isZero();
    }

    @Test
    @DisplayName("Foul selection is traced with a severity matching the card")
    void foulSelectionTrace() {
        InMemoryTraceRecorder trace = new InMemoryTraceRecorder();

        discipline.maybeFoul(defending, 20, new ScriptedRandomSource(0.0, 0.0), trace);

        assertThat(trace.events()).singleElement().satisfies(e -> {
            assertThat(e.type()).isEqualTo(AiTraceType.FOUL_SELECTION);
            assertThat(e.severity()).isEqualTo(TraceSeverity.CRITICAL);
            assertThat(e.team()).isEqualTo(TeamSide.HOME);
            assertThat(e.outcome()).containsEntry("severity", "direct_red");
        });
    }

    @Test
    @DisplayName("Aggressive, rash players are picked more often than their fair share")
    void aggressionRaisesSelection() {
        String hotheadId = TestRosters.id("home", 9);
        Player hothead = new Player(hotheadId, "Hothead", null, 26, Position.MID,
                new PlayerAttributes(70, 70, 70, 70, 70, 70, 70, 70, 70, 70, 1, 99, 70, 70, 70), 100);
        TeamState team = TestMatches.teamState(TeamSide.HOME, TestRosters.withPlayer(home, hothead));
        SeededRandomSource rnd = new SeededRandomSource(42);

        int picked = 0;
        for (int i = 0; i < 2000; i++) {
            if (discipline.maybeFoul(team, 30, rnd, TraceRecorder.disabled()).orElseThrow().player().playerId().equals(hotheadId)) {
                picked++;
            }
        }

        // fair share would be about 2000 / 11
        assertThat(picked).isGreaterThan(250);
    }

    private static void appendCard(MatchState state, MatchEventType type, String playerId) {
        TestMatches.append(state, MatchEvent.forPlayer(state.stampMinute(), 0, type, TeamSide.HOME, playerId, null, type.wire()));
    }
}
