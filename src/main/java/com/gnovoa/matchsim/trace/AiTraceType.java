package com.gnovoa.matchsim.trace;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum AiTraceType {
    MINUTE_CONTEXT,
    ENERGY_TICK,
    EVENT_PROBABILITY,
    CHANCE_EVALUATION,
    FOUL_SELECTION,
    SUB_CANDIDATE,
    SUB_EXECUTED;

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AiTraceType fromWire(String value) {
        return AiTraceType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
