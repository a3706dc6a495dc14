package com.gnovoa.matchsim.core;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Why a substitution happened. {@link #MANUAL} is a human decision, the rest are AI reasons. */
public enum SubstitutionReason {
    FATIGUE,
    PROTECT_LEAD,
    TACTICAL,
    MANUAL;

    /** Machine-readable tag embedded in the substitution event description. */
    public String tag() {
        return "[ai_reason:" + wire() + "]";
    }

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }
}
