package com.gnovoa.matchsim.core;

import com.gnovoa.matchsim.model.Control;
import com.gnovoa.matchsim.model.Position;
import com.gnovoa.matchsim.model.Posture;
import com.gnovoa.matchsim.model.TeamSide;

import java.util.List;

/**
 * Read-only view of a live or finished match for UI rendering: score, clock, lineups, bench,
 * energy and bookings.
 */
public record MatchSnapshot(
        String matchId,
        long seed,
        MatchPhase phase,
        int minute,
        int stoppageMinutes,
        int homeScore,
        int awayScore,
        TeamSide possession,
        TeamSnapshot home,
        TeamSnapshot away,
        int eventCount
) {

    public record TeamSnapshot(
            String teamId,
            String name,
            Control control,
            String formation,
            Posture posture,
            int subsUsed,
            List<PlayerLine> lineup,
            List<PlayerLine> bench
    ) {}

    /** @param energy live energy rounded to one decimal */
    public record PlayerLine(
            String playerId,
            String name,
            Position position,
            double energy,
            int bookings,
            boolean sentOff,
            int minutesPlayed
    ) {}
}
