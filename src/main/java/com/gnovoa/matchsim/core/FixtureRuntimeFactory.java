package com.gnovoa.matchsim.core;

import com.gnovoa.matchsim.config.SimProperties;
import com.gnovoa.matchsim.out.EventPublisher;
import com.gnovoa.matchsim.trace.InMemoryTraceRecorder;
import com.gnovoa.matchsim.trace.TraceRecorder;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Builds rounds of matches. Every match gets its own engine, state and random stream; only the
 * rosters are shared.
 */
public final class FixtureRuntimeFactory {

    private final MatchFactory matches;
    private final EventPublisher publisher;
    private final SimProperties simProps;

    public FixtureRuntimeFactory(MatchFactory matches, EventPublisher publisher, SimProperties simProps) {
        this.matches = matches;
        this.publisher = publisher;
        this.simProps = simProps;
    }

    /**
     * Creates a paced, live round. Call {@link FixtureRuntime#start()} to begin ticking.
     *
     * @throws MatchSetupException if any match of the round cannot start
     */
    public FixtureRuntime create(List<MatchSetup> setups, boolean traced) {
        String fixtureId = "fx-" + UUID.randomUUID();

        List<MatchEngine> engines = new ArrayList<>();
        List<FixtureRuntime.RunningMatch> running = new ArrayList<>();

        for (MatchSetup setup : setups) {
            MatchEngine engine = matches.create(setup, recorder(traced), publisher, fixtureId);
            engines.add(engine);
            running.add(new FixtureRuntime.RunningMatch(engine.matchId(), setup.home().name(), setup.away().name()));
        }

        return new FixtureRuntimeImpl(fixtureId, engines, running, simProps);
    }

    /**
     * Simulates a whole round to full time on a thread pool, one match per task.
     *
     * @return finished engines, in setup order
     * @throws MatchSetupException if any match of the round cannot start
     */
    public List<MatchEngine> simulateRound(List<MatchSetup> setups, int threads, boolean traced) {
        List<MatchEngine> engines = new ArrayList<>();
        for (MatchSetup setup : setups) engines.add(matches.create(setup, recorder(traced), EventPublisher.NOOP, null));

        ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, threads));
        try {
            List<Future<?>> pending = new ArrayList<>();
            for (MatchEngine engine : engines) pending.add(pool.submit(engine::simulateToEnd));
            for (Future<?> f : pending) f.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Round simulation interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Round simulation failed", e.getCause());
        } finally {
            pool.shutdownNow();
        }
        return engines;
    }

    private TraceRecorder recorder(boolean traced) {
        return traced ? new InMemoryTraceRecorder(simProps.maxTraceEvents()) : TraceRecorder.disabled();
    }
}
