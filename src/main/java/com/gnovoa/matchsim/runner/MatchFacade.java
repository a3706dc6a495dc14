package com.gnovoa.matchsim.runner;

import com.gnovoa.matchsim.api.dto.CreateMatchRequest;
import com.gnovoa.matchsim.api.dto.MatchCreatedResponse;
import com.gnovoa.matchsim.api.dto.RoundRequest;
import com.gnovoa.matchsim.api.dto.RoundResponse;
import com.gnovoa.matchsim.api.dto.SubstitutionRequest;
import com.gnovoa.matchsim.api.dto.TracesResponse;
import com.gnovoa.matchsim.config.SimProperties;
import com.gnovoa.matchsim.core.FixtureRuntime;
import com.gnovoa.matchsim.core.FixtureRuntimeFactory;
import com.gnovoa.matchsim.core.MatchEngine;
import com.gnovoa.matchsim.core.MatchFactory;
import com.gnovoa.matchsim.core.MatchSetup;
import com.gnovoa.matchsim.core.MatchSetupException;
import com.gnovoa.matchsim.core.MatchSnapshot;
import com.gnovoa.matchsim.core.SubstitutionRejectedException;
import com.gnovoa.matchsim.events.MatchEvent;
import com.gnovoa.matchsim.model.Control;
import com.gnovoa.matchsim.model.Tactics;
import com.gnovoa.matchsim.model.Team;
import com.gnovoa.matchsim.model.TeamSide;
import com.gnovoa.matchsim.out.EventPublisher;
import com.gnovoa.matchsim.rosters.DefaultTactics;
import com.gnovoa.matchsim.rosters.RosterCatalog;
import com.gnovoa.matchsim.sim.HalfTimeAdvisor;
import com.gnovoa.matchsim.stats.EventLogReducer;
import com.gnovoa.matchsim.stats.MatchRecord;
import com.gnovoa.matchsim.stats.MatchStats;
import com.gnovoa.matchsim.stats.MatchStatsAggregator;
import com.gnovoa.matchsim.stats.Scoreboard;
import com.gnovoa.matchsim.trace.InMemoryTraceRecorder;
import com.gnovoa.matchsim.trace.TraceQuery;
import com.gnovoa.matchsim.trace.TraceRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/** Use cases behind the match and round endpoints. */
@Component
public final class MatchFacade {

    private static final Logger log = LoggerFactory.getLogger(MatchFacade.class);

    private final MatchRegistry registry;
    private final MatchFactory matches;
    private final FixtureRuntimeFactory fixtures;
    private final RosterCatalog rosters;
    private final DefaultTactics defaultTactics;
    private final MatchStatsAggregator statsAggregator;
    private final EventLogReducer reducer;
    private final EventPublisher publisher;
    private final SimProperties simProps;

    public MatchFacade(MatchRegistry registry, MatchFactory matches, FixtureRuntimeFactory fixtures,
                       RosterCatalog rosters, DefaultTactics defaultTactics, MatchStatsAggregator statsAggregator,
                       EventLogReducer reducer, EventPublisher publisher, SimProperties simProps) {
        this.registry = registry;
        this.matches = matches;
        this.fixtures = fixtures;
        this.rosters = rosters;
        this.defaultTactics = defaultTactics;
        this.statsAggregator = statsAggregator;
        this.reducer = reducer;
        this.publisher = publisher;
        this.simProps = simProps;
    }

    public MatchCreatedResponse create(CreateMatchRequest req) {
        Team home = team(req.homeTeamId());
        Team away = team(req.awayTeamId());
        long seed = req.seed() != null ? req.seed() : ThreadLocalRandom.current().nextLong();
        boolean traced = Boolean.TRUE.equals(req.trace());

        MatchSetup setup = new MatchSetup(
                "m-" + UUID.randomUUID(),
                home,
                away,
                tacticsOrDefault(home, req.homeTactics()),
                tacticsOrDefault(away, req.awayTactics()),
                req.homeControl(),
                req.awayControl(),
                seed,
                Boolean.TRUE.equals(req.neutralVenue()));

        TraceRecorder trace = traced ? new InMemoryTraceRecorder(simProps.maxTraceEvents()) : TraceRecorder.disabled();
        MatchEngine engine = matches.create(setup, trace, publisher, null);
        registry.register(engine);
        log.info("Created match {}: {} vs {} (seed {}, traced {})", engine.matchId(), home.name(), away.name(), seed, traced);
        return new MatchCreatedResponse(engine.matchId(), seed, traced, Map.of("match", "/ws/matches/" + engine.matchId()));
    }

    /** @param minutes at least 1 */
    public MatchSnapshot advance(String matchId, int minutes) {
        if (minutes < 1) throw new IllegalArgumentException("minutes must be at least 1, got " + minutes);
        MatchEngine engine = registry.match(matchId);
        engine.advance(minutes);
        return engine.snapshot();
    }

    public MatchSnapshot finish(String matchId) {
        MatchEngine engine = registry.match(matchId);
        engine.simulateToEnd();
        return engine.snapshot();
    }

    /** Discarding is a cancellation: the match simply stops being reachable. */
    public void discard(String matchId) {
        registry.remove(matchId);
    }

    public MatchEvent substitute(String matchId, SubstitutionRequest req) {
        if (req.side() == null) throw new SubstitutionRejectedException("side is required");
        return registry.match(matchId).substitute(req.side(), req.outgoingPlayerId(), req.incomingPlayerId());
    }

    public MatchSnapshot snapshot(String matchId) {
        return registry.match(matchId).snapshot();
    }

    public List<MatchEvent> events(String matchId) {
        return registry.match(matchId).events();
    }

    public TracesResponse traces(String matchId, TraceQuery query) {
        MatchEngine engine = registry.match(matchId);
        if (!(engine.trace() instanceof InMemoryTraceRecorder recorder)) {
            return new TracesResponse(matchId, false, 0, Map.of(), List.of());
        }
        Map<String, Integer> counts = new LinkedHashMap<>();
        recorder.countsByType().forEach((type, n) -> counts.put(type.wire(), n));
        return new TracesResponse(matchId, true, recorder.dropped(), counts, recorder.query(query));
    }

    public MatchStats stats(String matchId) {
        return statsAggregator.aggregate(record(registry.match(matchId)));
    }

    public Scoreboard timeline(String matchId, Integer upToMinute) {
        List<MatchEvent> events = registry.match(matchId).events();
        return upToMinute == null ? reducer.replay(events) : reducer.replay(events, upToMinute);
    }

    public HalfTimeAdvisor.HalfTimeHints halfTimeHints(String matchId, TeamSide side) {
        return registry.match(matchId).halfTimeHints(side == null ? TeamSide.HOME : side);
    }

    /** Starts a round: paced live by default, or simulated to full time in parallel. */
    public RoundResponse startRound(RoundRequest req) {
        if (req.matches() == null || req.matches().isEmpty()) throw new MatchSetupException("A round needs at least one match");
        boolean traced = Boolean.TRUE.equals(req.trace());

        List<MatchSetup> setups = new ArrayList<>();
        for (RoundRequest.Pairing p : req.matches()) {
            Team home = team(p.homeTeamId());
            Team away = team(p.awayTeamId());
            long seed = p.seed() != null ? p.seed() : ThreadLocalRandom.current().nextLong();
            setups.add(MatchSetup.aiVsAi("m-" + UUID.randomUUID(), home, away,
                    defaultTactics.pick(home), defaultTactics.pick(away), seed));
        }

        if (Boolean.TRUE.equals(req.instant())) {
            List<MatchEngine> done = fixtures.simulateRound(setups, Runtime.getRuntime().availableProcessors(), traced);
            done.forEach(registry::register);
            List<RoundResponse.MatchItem> items = new ArrayList<>();
            for (int i = 0; i < done.size(); i++) items.add(item(done.get(i), setups.get(i)));
            return new RoundResponse(null, "FINISHED", Map.of(), items);
        }

        FixtureRuntime fixture = fixtures.create(setups, traced);
        registry.register(fixture);
        fixture.start();

        List<RoundResponse.MatchItem> items = new ArrayList<>();
        for (int i = 0; i < fixture.engines().size(); i++) items.add(item(fixture.engines().get(i), setups.get(i)));
        return new RoundResponse(fixture.fixtureId(), "RUNNING",
                Map.of("fixture", "/ws/fixtures/" + fixture.fixtureId()), items);
    }

    private RoundResponse.MatchItem item(MatchEngine engine, MatchSetup setup) {
        MatchSnapshot s = engine.snapshot();
        return new RoundResponse.MatchItem(engine.matchId(), setup.home().name(), setup.away().name(), setup.seed(),
                s.homeScore(), s.awayScore(), Map.of("match", "/ws/matches/" + engine.matchId()));
    }

    static MatchRecord record(MatchEngine engine) {
        return engine.read(state -> new MatchRecord(
                state.matchId(),
                state.home().team().teamId(),
                state.away().team().teamId(),
                state.home().startingLineup(),
                state.away().startingLineup(),
                state.events()));
    }

    private Team team(String teamId) {
        return rosters.find(teamId).orElseThrow(() -> new MatchSetupException("Unknown team " + teamId));
    }

    private Tactics tacticsOrDefault(Team team, Tactics requested) {
        return requested == null ? defaultTactics.pick(team) : requested;
    }
}
