package com.gnovoa.matchsim.core;

import com.gnovoa.matchsim.config.SimProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Paces a round: every {@code sim.tick-millis} each unfinished match plays one minute. Pacing
 * only decides when ticks happen, never what they draw.
 */
public final class FixtureTicker {

    private static final Logger log = LoggerFactory.getLogger(FixtureTicker.class);

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
    private final List<MatchEngine> engines;
    private final int tickMillis;

    public FixtureTicker(List<MatchEngine> engines, SimProperties props) {
        this.engines = engines;
        this.tickMillis = props.tickMillis();
    }

    public void start(Runnable onAllFinished) {
        scheduler.scheduleAtFixedRate(() -> tick(onAllFinished), 0, tickMillis, TimeUnit.MILLISECONDS);
    }

    public void stopNow() {
        scheduler.shutdownNow();
    }

    private void tick(Runnable onAllFinished) {
        try {
            for (MatchEngine e : engines) e.tick();
        } catch (RuntimeException e) {
            // an exception escaping here would silently cancel the schedule
            log.error("Fixture tick failed, stopping the round", e);
            stopNow();
            onAllFinished.run();
            return;
        }

        boolean allFinished = engines.stream().allMatch(MatchEngine::isFinished);
        if (allFinished) {
            onAllFinished.run();
            stopNow();
        }
    }
}
