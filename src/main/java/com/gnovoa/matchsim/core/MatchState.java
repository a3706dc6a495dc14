package com.gnovoa.matchsim.core;

import com.gnovoa.matchsim.config.SimProperties;
import com.gnovoa.matchsim.events.MatchClockSnapshot;
import com.gnovoa.matchsim.events.MatchEvent;
import com.gnovoa.matchsim.events.MatchEventType;
import com.gnovoa.matchsim.model.TeamSide;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * In-memory live state for a single football match.
 *
 * <p>This class owns:
 * <ul>
 *   <li>Match clock and phase ({@link MatchPhase})</li>
 *   <li>Score and possession</li>
 *   <li>The two {@link TeamState} overlays (energy, bookings, dismissals, lineups)</li>
 *   <li>The append-only event log</li>
 * </ul>
 *
 * <p>Events carry their own effects: appending a scoring event moves the score, appending a
 * card books or dismisses the player. Only {@link MatchEngine} mutates the state. It does not
 * handle persistence; consumers read {@link MatchEngine#snapshot()} or the terminal state.
 */
public final class MatchState {

    private final String matchId;
    private final long seed;
    private final boolean neutralVenue;
    private final SimProperties.Match clock;

    private final TeamState home;
    private final TeamState away;

    private MatchPhase phase = MatchPhase.SCHEDULED;

    /** Elapsed clock minutes; runs past 90 into stoppage time. */
    private int minute = 0;
    private int stoppageMinutes = 0;

    private int homeScore = 0;
    private int awayScore = 0;

    private TeamSide possession = TeamSide.HOME;

    private final List<MatchEvent> events = new ArrayList<>();

    MatchState(String matchId, long seed, boolean neutralVenue, SimProperties.Match clock,
               TeamState home, TeamState away) {
        this.matchId = matchId;
        this.seed = seed;
        this.neutralVenue = neutralVenue;
        this.clock = clock;
        this.home = home;
        this.away = away;
    }

    public String matchId() { return matchId; }
    public long seed() { return seed; }
    public boolean neutralVenue() { return neutralVenue; }
    public TeamState home() { return home; }
    public TeamState away() { return away; }
    public MatchPhase phase() { return phase; }
    public int minute() { return minute; }
    public int stoppageMinutes() { return stoppageMinutes; }
    public int homeScore() { return homeScore; }
    public int awayScore() { return awayScore; }
    public TeamSide possession() { return possession; }

    public int halfTimeMinute() { return clock.halfTimeMinute(); }
    public int regulationMinutes() { return clock.regulationMinutes(); }

    /** Last elapsed minute of the match, i.e. 90 plus stoppage. */
    public int finalMinute() { return clock.regulationMinutes() + stoppageMinutes; }

    /** @return true when the match reached full time. */
    public boolean isFinished() { return phase == MatchPhase.FULL_TIME; }

    public TeamState side(TeamSide side) {
        return side == TeamSide.HOME ? home : away;
    }

    public int score(TeamSide side) {
        return side == TeamSide.HOME ? homeScore : awayScore;
    }

    /** Goals for minus goals against, from {@code side}'s point of view. */
    public int goalDifference(TeamSide side) {
        return score(side) - score(side.opposite());
    }

    /** Read-only view of the ordered event log. */
    public List<MatchEvent> events() {
        return Collections.unmodifiableList(events);
    }

    public MatchClockSnapshot clockSnapshot() {
        return new MatchClockSnapshot(phase.wire(), minute, stoppageMinutes, homeScore, awayScore);
    }

    /** Event stamp for the current minute: stoppage minutes read as 90+n. */
    public int stampMinute() {
        return Math.min(minute, clock.regulationMinutes());
    }

    public int stampAddedTime() {
        return Math.max(0, minute - clock.regulationMinutes());
    }

    // --- mutators (MatchEngine only) -----------------------------------------------------

    void phase(MatchPhase next) {
        this.phase = next;
    }

    void stoppageMinutes(int stoppage) {
        this.stoppageMinutes = stoppage;
    }

    void advanceMinute() {
        minute++;
    }

    void possession(TeamSide side) {
        this.possession = side;
    }

    /**
     * Appends an event and applies its effect on score and discipline.
     *
     * @throws IllegalStateException if the event would break chronological order
     */
    void append(MatchEvent event) {
        if (event.type() == MatchEventType.SUBSTITUTION) {
            throw new IllegalArgumentException("substitutions go through substitute()");
        }
        checkOrder(event);
        switch (event.type()) {
            case GOAL, OWN_GOAL, PENALTY_SCORED -> {
                if (event.team() == TeamSide.HOME) homeScore++; else awayScore++;
            }
            case YELLOW_CARD -> side(event.team()).book(event.playerId());
            case RED_CARD -> side(event.team()).sendOff(event.playerId());
            default -> { }
        }
        events.add(event);
    }

    void substitute(TeamSide side, String outgoingId, String incomingId, SubstitutionReason reason,
                    MatchEvent event) {
        checkOrder(event);
        side(side).substitute(outgoingId, incomingId, reason);
        events.add(event);
    }

    private void checkOrder(MatchEvent event) {
        if (events.isEmpty()) return;
        MatchEvent last = events.get(events.size() - 1);
        if (MatchEvent.CHRONOLOGICAL.compare(event, last) < 0) {
            throw new IllegalStateException("event " + event.type() + " at " + event.clock()
                    + " is older than " + last.type() + " at " + last.clock());
        }
    }
}
