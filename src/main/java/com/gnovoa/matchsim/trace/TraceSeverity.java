package com.gnovoa.matchsim.trace;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum TraceSeverity {
    INFO,
    WARNING,
    CRITICAL;

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }
}
