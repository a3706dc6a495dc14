package com.gnovoa.matchsim.runner;

import com.gnovoa.matchsim.config.SimProperties;
import com.gnovoa.matchsim.core.FixtureRuntime;
import com.gnovoa.matchsim.core.MatchEngine;
import com.gnovoa.matchsim.core.UnknownMatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * In-memory index of the matches and rounds this instance is running or has finished.
 *
 * <p>Live matches stay until they are removed. Finished matches are kept up to
 * {@code sim.retention.max-finished-matches}, oldest registration dropped first. A round leaves
 * the index once its ticker stops; its matches then follow the same retention.
 */
@Component
public final class MatchRegistry {

    private static final Logger log = LoggerFactory.getLogger(MatchRegistry.class);

    private final Map<String, MatchEngine> matches = new ConcurrentHashMap<>();
    private final Queue<String> registrationOrder = new ConcurrentLinkedQueue<>();
    private final Map<String, FixtureRuntime> fixtures = new ConcurrentHashMap<>();
    private final int maxFinishedMatches;

    public MatchRegistry(SimProperties simProps) {
        this.maxFinishedMatches = simProps.retention().maxFinishedMatches();
    }

    public void register(MatchEngine engine) {
        if (matches.putIfAbsent(engine.matchId(), engine) != null) {
            throw new IllegalStateException("Match id already in use: " + engine.matchId());
        }
        registrationOrder.add(engine.matchId());
        evictFinished();
    }

    public void register(FixtureRuntime fixture) {
        fixtures.put(fixture.fixtureId(), fixture);
        fixture.onFinished(() -> {
            fixtures.remove(fixture.fixtureId());
            log.debug("Fixture {} left the registry", fixture.fixtureId());
        });
        fixture.engines().forEach(this::register);
    }

    /** @throws UnknownMatchException if no match has this id */
    public MatchEngine match(String matchId) {
        MatchEngine engine = matches.get(matchId);
        if (engine == null) throw new UnknownMatchException(matchId);
        return engine;
    }

    /**
     * Forgets a match. A match still ticking inside a round keeps ticking there, it just can no
     * longer be looked up.
     *
     * @throws UnknownMatchException if no match has this id
     */
    public void remove(String matchId) {
        if (matches.remove(matchId) == null) throw new UnknownMatchException(matchId);
        registrationOrder.remove(matchId);
        log.info("Removed match {}", matchId);
    }

    public Optional<FixtureRuntime> fixture(String fixtureId) {
        return Optional.ofNullable(fixtures.get(fixtureId));
    }

    public int size() {
        return matches.size();
    }

    private synchronized void evictFinished() {
        long finished = matches.values().stream().filter(MatchEngine::isFinished).count();
        Iterator<String> oldestFirst = registrationOrder.iterator();
        while (finished > maxFinishedMatches && oldestFirst.hasNext()) {
            String id = oldestFirst.next();
            MatchEngine engine = matches.get(id);
            if (engine == null) {
                oldestFirst.remove();
            } else if (engine.isFinished()) {
                matches.remove(id);
                oldestFirst.remove();
                finished--;
                log.debug("Evicted finished match {}", id);
            }
        }
    }
}
