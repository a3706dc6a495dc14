package com.gnovoa.matchsim.stats;

import com.gnovoa.matchsim.events.MatchEvent;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Client-side view of a match rebuilt from its event log by {@link EventLogReducer}. Never a
 * source of truth: it only caches what the server already appended.
 *
 * @param phase derived phase wire name ({@code scheduled}, {@code first_half}, ...)
 * @param bookings playerId to bookings held (0-2)
 * @param substitutions substitution events in order
 */
public record Scoreboard(
        String phase,
        int minute,
        int addedTime,
        int homeScore,
        int awayScore,
        Map<String, Integer> bookings,
        Set<String> sentOff,
        int homeSubsUsed,
        int awaySubsUsed,
        List<MatchEvent> substitutions,
        List<MatchEvent> events
) {

    public static final Scoreboard EMPTY =
            new Scoreboard("scheduled", 0, 0, 0, 0, Map.of(), Set.of(), 0, 0, List.of(), List.of());
}
