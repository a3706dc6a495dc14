package com.gnovoa.matchsim.stats;

import com.gnovoa.matchsim.model.TeamSide;

import java.util.List;

/** Per-player lines and per-team standing deltas recomputed from one match's event log. */
public record MatchStats(String matchId, List<PlayerMatchLine> players, StandingDelta home, StandingDelta away) {

    public record PlayerMatchLine(
            String playerId,
            TeamSide side,
            int minutes,
            int goals,
            int assists,
            int ownGoals,
            int yellowCards,
            int redCards
    ) {}

    public record StandingDelta(
            String teamId,
            int played,
            int won,
            int drawn,
            int lost,
            int goalsFor,
            int goalsAgainst,
            int points
    ) {

        public int goalDifference() {
            return goalsFor - goalsAgainst;
        }
    }
}
