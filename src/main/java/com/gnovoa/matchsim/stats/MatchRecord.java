package com.gnovoa.matchsim.stats;

import com.gnovoa.matchsim.events.MatchEvent;

import java.util.List;

/**
 * What a finished match leaves behind for season bookkeeping: who started and the event log.
 */
public record MatchRecord(
        String matchId,
        String homeTeamId,
        String awayTeamId,
        List<String> homeStarters,
        List<String> awayStarters,
        List<MatchEvent> events
) {

    public MatchRecord {
        homeStarters = List.copyOf(homeStarters);
        awayStarters = List.copyOf(awayStarters);
        events = List.copyOf(events);
    }
}
