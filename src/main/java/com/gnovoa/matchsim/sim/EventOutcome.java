package com.gnovoa.matchsim.sim;

import com.gnovoa.matchsim.events.MatchEvent;
import com.gnovoa.matchsim.model.TeamSide;

import java.util.List;

/**
 * Result of a triggered minute: the primary event followed by its same-minute follow-ups
 * (foul then card, corner then goal), in append order.
 *
 * @param injuredSide side of the injured player, null unless the primary event is an injury
 * @param injuredPlayerId player whose live energy is knocked down, null unless injured
 */
public record EventOutcome(List<MatchEvent> events, TeamSide injuredSide, String injuredPlayerId) {

    public EventOutcome {
        events = List.copyOf(events);
        if (events.isEmpty()) throw new IllegalArgumentException("an outcome carries at least one event");
    }

    public static EventOutcome of(MatchEvent... events) {
        return new EventOutcome(List.of(events), null, null);
    }

    public static EventOutcome injury(MatchEvent event, TeamSide side, String playerId) {
        return new EventOutcome(List.of(event), side, playerId);
    }
}
