package com.gnovoa.matchsim.events;

import java.time.Instant;

/**
 * Envelope pushed to live subscribers for every newly appended {@link MatchEvent}.
 *
 * @param fixtureId round the match belongs to, or null for a standalone match
 */
public record LiveMatchUpdate(
        String matchId,
        String fixtureId,
        Instant publishedAt,
        MatchClockSnapshot match,
        MatchEvent event
) {}
