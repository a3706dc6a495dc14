package com.gnovoa.matchsim.core;

import com.gnovoa.matchsim.model.Control;
import com.gnovoa.matchsim.model.Tactics;
import com.gnovoa.matchsim.model.Team;

/**
 * Everything needed to kick off a match. Rosters are shared read-only between matches.
 *
 * @param seed seed of the match's own random stream
 * @param neutralVenue when true the home side gets no home advantage
 */
public record MatchSetup(
        String matchId,
        Team home,
        Team away,
        Tactics homeTactics,
        Tactics awayTactics,
        Control homeControl,
        Control awayControl,
        long seed,
        boolean neutralVenue
) {

    public MatchSetup {
        homeControl = homeControl == null ? Control.AI : homeControl;
        awayControl = awayControl == null ? Control.AI : awayControl;
    }

    /** Two AI sides at the home ground. */
    public static MatchSetup aiVsAi(String matchId, Team home, Team away, Tactics homeTactics, Tactics awayTactics, long seed) {
        return new MatchSetup(matchId, home, away, homeTactics, awayTactics, Control.AI, Control.AI, seed, false);
    }
}
