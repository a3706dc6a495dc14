package com.gnovoa.matchsim.events;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.gnovoa.matchsim.model.TeamSide;

import java.util.Comparator;

/**
 * One entry of the match log. Immutable once appended.
 *
 * <p>{@code addedTime} is only non-zero for events played in stoppage time, which are stamped at
 * minute 90 (e.g. 90+3). For {@link MatchEventType#OWN_GOAL} the {@code team} is the side credited
 * with the goal and {@code playerId} the opponent who put it in. For substitutions
 * {@code playerId} is the incoming and {@code assistPlayerId} the outgoing player.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MatchEvent(
        int minute,
        int addedTime,
        MatchEventType type,
        TeamSide team,
        String playerId,
        String assistPlayerId,
        String description
) {

    /** Chronological order; events of the same minute keep their log order when sorted stably. */
    public static final Comparator<MatchEvent> CHRONOLOGICAL =
            Comparator.comparingInt(MatchEvent::minute).thenComparingInt(MatchEvent::addedTime);

    public static MatchEvent of(int minute, int addedTime, MatchEventType type, TeamSide team, String description) {
        return new MatchEvent(minute, addedTime, type, team, null, null, description);
    }

    public static MatchEvent forPlayer(int minute, int addedTime, MatchEventType type, TeamSide team,
                                       String playerId, String assistPlayerId, String description) {
        return new MatchEvent(minute, addedTime, type, team, playerId, assistPlayerId, description);
    }

    /** Display form of the clock, e.g. {@code 90+2'}. */
    public String clock() {
        return addedTime > 0 ? minute + "+" + addedTime + "'" : minute + "'";
    }
}
