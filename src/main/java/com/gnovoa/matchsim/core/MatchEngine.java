package com.gnovoa.matchsim.core;

import com.gnovoa.matchsim.config.SimProperties;
import com.gnovoa.matchsim.events.LiveMatchUpdate;
import com.gnovoa.matchsim.events.MatchEvent;
import com.gnovoa.matchsim.events.MatchEventType;
import com.gnovoa.matchsim.model.Control;
import com.gnovoa.matchsim.model.Player;
import com.gnovoa.matchsim.model.TeamSide;
import com.gnovoa.matchsim.out.EventPublisher;
import com.gnovoa.matchsim.sim.EventOutcome;
import com.gnovoa.matchsim.sim.HalfTimeAdvisor;
import com.gnovoa.matchsim.sim.RandomSource;
import com.gnovoa.matchsim.sim.SubstitutionDecision;
import com.gnovoa.matchsim.trace.AiTraceEvent;
import com.gnovoa.matchsim.trace.AiTraceType;
import com.gnovoa.matchsim.trace.TraceRecorder;
import com.gnovoa.matchsim.trace.TraceSeverity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Minute-by-minute state machine of one match.
 *
 * <p>Each {@link #tick()} plays one minute: kickoff on the first tick, then energy decay, AI
 * substitutions (home before away), one probability roll, and the scheduled half-time and
 * full-time whistles. Ticks after full time are no-ops. Human substitutions go through
 * {@link #substitute(TeamSide, String, String)} on the same lock, so a match is never mutated
 * concurrently.
 */
public final class MatchEngine {

    private static final Logger log = LoggerFactory.getLogger(MatchEngine.class);

    private final MatchState state;
    private final MatchModels models;
    private final RandomSource rnd;
    private final TraceRecorder trace;
    private final EventPublisher publisher;
    private final String fixtureId;

    private final SimProperties.Substitution subs;

    public MatchEngine(MatchState state, MatchModels models, RandomSource rnd, TraceRecorder trace,
                       EventPublisher publisher, String fixtureId) {
        this.state = state;
        this.models = models;
        this.rnd = rnd;
        this.trace = trace == null ? TraceRecorder.disabled() : trace;
        this.publisher = publisher == null ? EventPublisher.NOOP : publisher;
        this.fixtureId = fixtureId;
        this.subs = models.properties().substitution();
    }

    public String matchId() { return state.matchId(); }
    public String fixtureId() { return fixtureId; }
    public TraceRecorder trace() { return trace; }

    /** Live state. Callers outside the engine must only read it while holding the engine lock. */
    MatchState state() { return state; }

    public synchronized boolean isFinished() {
        return state.isFinished();
    }

    public synchronized MatchPhase phase() {
        return state.phase();
    }

    /**
     * Plays one minute.
     *
     * @return false when the match had already finished
     */
    public synchronized boolean tick() {
        if (state.isFinished()) return false;
        if (state.phase() == MatchPhase.SCHEDULED) kickOff();
        if (state.phase() == MatchPhase.HALF_TIME) state.phase(MatchPhase.SECOND_HALF);

        state.advanceMinute();
        int minute = state.minute();
        recordMinuteContext(minute);

        drainEnergy(state.home(), minute);
        drainEnergy(state.away(), minute);

        aiSubstitutions(state.home(), minute);
        aiSubstitutions(state.away(), minute);

        state.possession(models.probability().rollPossession(state, rnd));
        models.probability().rollMinute(state, rnd, trace).ifPresent(this::apply);

        if (minute == state.halfTimeMinute()) {
            emit(MatchEvent.of(state.stampMinute(), state.stampAddedTime(), MatchEventType.HALF_TIME, TeamSide.HOME,
                    "Half-time: " + scoreline()));
            state.phase(MatchPhase.HALF_TIME);
        } else if (minute >= state.finalMinute()) {
            emit(MatchEvent.of(state.stampMinute(), state.stampAddedTime(), MatchEventType.FULL_TIME, TeamSide.HOME,
                    "Full-time: " + scoreline()));
            state.phase(MatchPhase.FULL_TIME);
            log.info("Match {} finished {} after {} events", state.matchId(), scoreline(), state.events().size());
        }
        return true;
    }

    /**
     * Plays up to {@code minutes} ticks.
     *
     * @return the number of ticks that actually played
     */
    public synchronized int advance(int minutes) {
        int played = 0;
        while (played < minutes && tick()) played++;
        return played;
    }

    /** Plays until full time. Always terminates: every tick advances the clock. */
    public synchronized void simulateToEnd() {
        while (tick()) {
            // keep ticking
        }
    }

    /**
     * Manual substitution for a human-controlled side.
     *
     * @throws SubstitutionRejectedException if the side is AI-controlled, the match is not
     *     running, or the swap breaks a substitution rule
     */
    public synchronized MatchEvent substitute(TeamSide side, String outgoingId, String incomingId) {
        TeamState team = state.side(side);
        if (team.control() != Control.HUMAN) {
            throw new SubstitutionRejectedException(team.team().name() + " is AI-controlled");
        }
        if (!state.phase().inProgress()) {
            throw new SubstitutionRejectedException("match is " + state.phase().wire());
        }
        Optional<String> rejection = team.checkSubstitution(outgoingId, incomingId, subs.maxSubs(), true);
        if (rejection.isPresent()) {
            throw new SubstitutionRejectedException(rejection.get());
        }
        Player out = team.player(outgoingId);
        Player in = team.player(incomingId);
        return executeSubstitution(team, out, in, SubstitutionReason.MANUAL, team.energyOf(out), team.energyOf(in));
    }

    // --- reads ----------------------------------------------------------------------------

    public synchronized List<MatchEvent> events() {
        return List.copyOf(state.events());
    }

    public synchronized MatchSnapshot snapshot() {
        return new MatchSnapshot(
                state.matchId(),
                state.seed(),
                state.phase(),
                state.minute(),
                state.stoppageMinutes(),
                state.homeScore(),
                state.awayScore(),
                state.possession(),
                teamSnapshot(state.home()),
                teamSnapshot(state.away()),
                state.events().size());
    }

    public synchronized HalfTimeAdvisor.HalfTimeHints halfTimeHints(TeamSide side) {
        TeamState own = state.side(side);
        TeamState opponent = state.side(side.opposite());
        return models.halfTime().hints(state.score(side), state.score(side.opposite()),
                own.formation(), opponent.formation());
    }

    /** Runs {@code reader} against the live state under the engine lock. */
    public synchronized <T> T read(Function<MatchState, T> reader) {
        return reader.apply(state);
    }

    // --- tick steps -----------------------------------------------------------------------

    private void kickOff() {
        SimProperties.Match clock = models.properties().match();
        state.stoppageMinutes(rnd.nextIntInclusive(clock.stoppageMin(), clock.stoppageMax()));
        state.phase(MatchPhase.FIRST_HALF);
        emit(MatchEvent.of(0, 0, MatchEventType.KICKOFF, TeamSide.HOME,
                "Kickoff! " + state.home().team().name() + " vs " + state.away().team().name()));
        log.info("Match {} kicked off: {} vs {} (seed {}, {} stoppage minutes)", state.matchId(),
                state.home().team().name(), state.away().team().name(), state.seed(), state.stoppageMinutes());
    }

    private void recordMinuteContext(int minute) {
        trace.record(() -> {
            Map<String, Object> inputs = new LinkedHashMap<>();
            inputs.put("phase", state.phase().wire());
            inputs.put("homeScore", state.homeScore());
            inputs.put("awayScore", state.awayScore());
            inputs.put("stoppageMinutes", state.stoppageMinutes());
            Map<String, Object> computed = new LinkedHashMap<>();
            computed.put("homePossessionShare", models.probability().homePossessionShare(state));
            computed.put("homeStrength", models.probability().teamStrength(state.home()));
            computed.put("awayStrength", models.probability().teamStrength(state.away()));
            return AiTraceEvent.info(AiTraceType.MINUTE_CONTEXT, minute, null,
                    "Minute " + minute + " at " + scoreline(), inputs, computed, Map.of());
        });
    }

    private void drainEnergy(TeamState team, int minute) {
        double fatigueThreshold = subs.fatigueThreshold();
        double total = 0;
        double lowest = 100;
        String lowestId = null;
        int count = 0;
        for (Player p : team.onPitch()) {
            team.playMinute(p.playerId());
            double next = models.energy().decay(p, team.energyOf(p), team.minutesPlayed(p.playerId()), team.posture());
            team.setEnergy(p.playerId(), next);
            total += next;
            count++;
            if (next < lowest) {
                lowest = next;
                lowestId = p.playerId();
            }
        }
        if (count == 0) return;

        double average = total / count;
        double min = lowest;
        String minId = lowestId;
        trace.record(() -> {
            TraceSeverity severity = min < fatigueThreshold / 2 ? TraceSeverity.CRITICAL
                    : min < fatigueThreshold ? TraceSeverity.WARNING
                    : TraceSeverity.INFO;
            Map<String, Object> computed = new LinkedHashMap<>();
            computed.put("averageEnergy", average);
            computed.put("lowestEnergy", min);
            computed.put("lowestPlayerId", minId);
            return new AiTraceEvent(AiTraceType.ENERGY_TICK, minute, team.side(), severity,
                    team.team().name() + " average energy " + Math.round(average),
                    Map.of("posture", team.posture().wire(), "onPitch", team.onPitch().size()),
                    computed, Map.of());
        });
    }

    private void aiSubstitutions(TeamState team, int minute) {
        if (team.control() != Control.AI) return;
        for (int i = 0; i < subs.maxPerMinute(); i++) {
            Optional<SubstitutionDecision> decision =
                    models.substitutions().evaluate(team, minute, state.goalDifference(team.side()), trace);
            if (decision.isEmpty()) return;

            SubstitutionDecision d = decision.get();
            Optional<String> rejection = team.checkSubstitution(
                    d.outgoing().playerId(), d.incoming().playerId(), subs.maxSubs(), false);
            if (rejection.isPresent()) {
                log.debug("Dropping AI substitution for {} at minute {}: {}", team.team().name(), minute, rejection.get());
                return;
            }
            executeSubstitution(team, d.outgoing(), d.incoming(), d.reason(), d.outgoingEnergy(), d.incomingEnergy());
        }
    }

    private MatchEvent executeSubstitution(TeamState team, Player out, Player in, SubstitutionReason reason,
                                           double outEnergy, double inEnergy) {
        String description = in.displayName() + " replaces " + out.displayName();
        if (reason != SubstitutionReason.MANUAL) description += " " + reason.tag();

        MatchEvent event = MatchEvent.forPlayer(state.stampMinute(), state.stampAddedTime(),
                MatchEventType.SUBSTITUTION, team.side(), in.playerId(), out.playerId(), description);
        state.substitute(team.side(), out.playerId(), in.playerId(), reason, event);
        publish(event);

        int used = team.subsUsed();
        final String traceDescription = description;
        trace.record(() -> {
            Map<String, Object> inputs = new LinkedHashMap<>();
            inputs.put("outgoing", out.playerId());
            inputs.put("incoming", in.playerId());
            Map<String, Object> computed = new LinkedHashMap<>();
            computed.put("outgoingEnergy", outEnergy);
            computed.put("incomingEnergy", inEnergy);
            Map<String, Object> outcome = new LinkedHashMap<>();
            outcome.put("reason", reason.wire());
            outcome.put("subsUsed", used);
            return AiTraceEvent.info(AiTraceType.SUB_EXECUTED, state.minute(), team.side(), traceDescription,
                    inputs, computed, outcome);
        });
        return event;
    }

    private void apply(EventOutcome outcome) {
        for (MatchEvent event : outcome.events()) emit(event);
        if (outcome.injuredPlayerId() != null) {
            TeamState team = state.side(outcome.injuredSide());
            double cap = models.properties().energy().injuryEnergyCap();
            String id = outcome.injuredPlayerId();
            team.setEnergy(id, Math.min(team.energyOf(id), cap));
        }
    }

    private void emit(MatchEvent event) {
        state.append(event);
        publish(event);
    }

    private void publish(MatchEvent event) {
        publisher.publish(new LiveMatchUpdate(state.matchId(), fixtureId, Instant.now(), state.clockSnapshot(), event));
    }

    private String scoreline() {
        return state.home().team().name() + " " + state.homeScore() + " - " + state.awayScore() + " "
                + state.away().team().name();
    }

    private static MatchSnapshot.TeamSnapshot teamSnapshot(TeamState team) {
        List<MatchSnapshot.PlayerLine> lineup = new ArrayList<>();
        for (String id : team.lineupIds()) lineup.add(line(team, team.player(id)));
        List<MatchSnapshot.PlayerLine> bench = new ArrayList<>();
        for (String id : team.benchIds()) {
            if (!team.lineupIds().contains(id)) bench.add(line(team, team.player(id)));
        }
        return new MatchSnapshot.TeamSnapshot(
                team.team().teamId(),
                team.team().name(),
                team.control(),
                team.formation().label(),
                team.posture(),
                team.subsUsed(),
                lineup,
                bench);
    }

    private static MatchSnapshot.PlayerLine line(TeamState team, Player p) {
        return new MatchSnapshot.PlayerLine(
                p.playerId(),
                p.displayName(),
                p.position(),
                Math.round(team.energyOf(p) * 10) / 10.0,
                team.bookingsOf(p.playerId()),
                team.isSentOff(p.playerId()),
                team.minutesPlayed(p.playerId()));
    }
}
