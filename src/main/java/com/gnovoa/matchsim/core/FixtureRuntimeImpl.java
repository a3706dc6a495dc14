package com.gnovoa.matchsim.core;

import com.gnovoa.matchsim.config.SimProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

public final class FixtureRuntimeImpl implements FixtureRuntime {

    private static final Logger log = LoggerFactory.getLogger(FixtureRuntimeImpl.class);

    private final String fixtureId;

    private final List<MatchEngine> engines;
    private final List<RunningMatch> matches;
    private final FixtureTicker ticker;

    private volatile boolean finished = false;
    private volatile Runnable onFinished = () -> {};

    public FixtureRuntimeImpl(
            String fixtureId,
            List<MatchEngine> engines,
            List<RunningMatch> matches,
            SimProperties props
    ) {
        this.fixtureId = fixtureId;
        this.engines = List.copyOf(engines);
        this.matches = List.copyOf(matches);
        this.ticker = new FixtureTicker(this.engines, props);
    }

    @Override public String fixtureId() { return fixtureId; }
    @Override public List<RunningMatch> matches() { return matches; }
    @Override public List<MatchEngine> engines() { return engines; }

    @Override public boolean isFinished() { return finished; }

    @Override
    public void start() {
        log.info("Starting fixture {} with {} matches", fixtureId, engines.size());
        ticker.start(() -> {
            finished = true;
            log.info("Fixture {} finished", fixtureId);
            onFinished.run();
        });
    }

    @Override
    public void stop() {
        ticker.stopNow();
        finished = true;
        log.info("Fixture {} stopped", fixtureId);
        onFinished.run();
    }

    @Override
    public void onFinished(Runnable callback) {
        this.onFinished = callback == null ? () -> {} : callback;
    }
}
