package com.gnovoa.matchsim.events;

/**
 * Clock and score at the moment an update is published. Attached to every live update for UI
 * convenience.
 */
public record MatchClockSnapshot(
        String phase,
        int minute,
        int stoppageMinutes,
        int homeScore,
        int awayScore
) {}
