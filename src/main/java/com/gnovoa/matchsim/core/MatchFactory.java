package com.gnovoa.matchsim.core;

import com.gnovoa.matchsim.model.Formation;
import com.gnovoa.matchsim.model.TeamSide;
import com.gnovoa.matchsim.out.EventPublisher;
import com.gnovoa.matchsim.sim.SeededRandomSource;
import com.gnovoa.matchsim.trace.TraceRecorder;

/**
 * Validates a {@link MatchSetup} and builds a ready-to-tick {@link MatchEngine} with its own
 * seeded random stream.
 */
public final class MatchFactory {

    private final MatchModels models;
    private final TacticsValidator validator;

    public MatchFactory(MatchModels models, TacticsValidator validator) {
        this.models = models;
        this.validator = validator;
    }

    public MatchModels models() { return models; }

    /**
     * @param trace recorder for this match, or null to run without tracing
     * @param fixtureId round the match belongs to, or null
     * @throws MatchSetupException if either side's tactics are malformed
     */
    public MatchEngine create(MatchSetup setup, TraceRecorder trace, EventPublisher publisher, String fixtureId) {
        if (setup.home() == null || setup.away() == null) throw new MatchSetupException("Both teams are required");
        if (setup.home().teamId().equals(setup.away().teamId())) {
            throw new MatchSetupException("A team cannot play itself: " + setup.home().teamId());
        }
        Formation homeFormation = validator.validate(setup.home(), setup.homeTactics());
        Formation awayFormation = validator.validate(setup.away(), setup.awayTactics());

        TeamState home = new TeamState(TeamSide.HOME, setup.home(), setup.homeTactics(), homeFormation, setup.homeControl());
        TeamState away = new TeamState(TeamSide.AWAY, setup.away(), setup.awayTactics(), awayFormation, setup.awayControl());
        MatchState state = new MatchState(setup.matchId(), setup.seed(), setup.neutralVenue(),
                models.properties().match(), home, away);

        return new MatchEngine(state, models, new SeededRandomSource(setup.seed()), trace, publisher, fixtureId);
    }
}
