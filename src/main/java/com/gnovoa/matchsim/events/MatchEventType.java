package com.gnovoa.matchsim.events;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public enum MatchEventType {
    GOAL,
    OWN_GOAL,
    PENALTY_SCORED,
    PENALTY_MISSED,
    CHANCE_MISSED,
    YELLOW_CARD,
    RED_CARD,
    SUBSTITUTION,
    INJURY,
    SAVE,
    CORNER,
    FREE_KICK,
    OFFSIDE,
    KICKOFF,
    HALF_TIME,
    FULL_TIME;

    private static final Set<MatchEventType> SCORING = EnumSet.of(GOAL, OWN_GOAL, PENALTY_SCORED);

    /** @return true when the event adds a goal to {@code team}'s score. */
    public boolean isScoring() {
        return SCORING.contains(this);
    }

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static MatchEventType fromWire(String value) {
        return MatchEventType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
