package com.gnovoa.matchsim.core;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** {@code SCHEDULED -> FIRST_HALF -> HALF_TIME -> SECOND_HALF -> FULL_TIME}; the last is terminal. */
public enum MatchPhase {
    SCHEDULED,
    FIRST_HALF,
    HALF_TIME,
    SECOND_HALF,
    FULL_TIME;

    public boolean inProgress() {
        return this == FIRST_HALF || this == HALF_TIME || this == SECOND_HALF;
    }

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }
}
