package com.gnovoa.matchsim.core;

import com.gnovoa.matchsim.model.Formation;
import com.gnovoa.matchsim.model.Player;
import com.gnovoa.matchsim.model.Position;
import com.gnovoa.matchsim.model.Tactics;
import com.gnovoa.matchsim.model.Team;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Rejects malformed tactics before kickoff. This is the only place a match can fail to start.
 */
public final class TacticsValidator {

    public static final int LINEUP_SIZE = 11;

    /**
     * @return the parsed formation
     * @throws MatchSetupException if the tactics cannot be played with this roster
     */
    public Formation validate(Team team, Tactics tactics) {
        if (tactics == null) throw new MatchSetupException("Missing tactics for " + team.name());

        Formation formation = Formation.fromLabel(tactics.formation())
                .orElseThrow(() -> new MatchSetupException(
                        "Unknown formation '" + tactics.formation() + "' for " + team.name()));

        List<String> lineup = tactics.lineup();
        if (lineup.size() != LINEUP_SIZE) {
            throw new MatchSetupException(team.name() + " lineup has " + lineup.size() + " players, expected " + LINEUP_SIZE);
        }

        Set<String> seen = new HashSet<>();
        int goalkeepers = 0;
        for (String id : lineup) {
            Player p = known(team, id);
            if (!seen.add(id)) throw new MatchSetupException("Player " + id + " appears twice in the " + team.name() + " lineup");
            if (p.position() == Position.GK) goalkeepers++;
        }
        if (goalkeepers != 1) {
            throw new MatchSetupException(team.name() + " lineup has " + goalkeepers + " goalkeepers, expected 1");
        }

        Set<String> bench = new HashSet<>();
        for (String id : tactics.substitutes()) {
            known(team, id);
            if (seen.contains(id)) throw new MatchSetupException("Player " + id + " is both starting and on the bench");
            if (!bench.add(id)) throw new MatchSetupException("Player " + id + " appears twice on the " + team.name() + " bench");
        }
        return formation;
    }

    private static Player known(Team team, String playerId) {
        return team.player(playerId)
                .orElseThrow(() -> new MatchSetupException("Unknown player " + playerId + " for " + team.name()));
    }
}
