package com.gnovoa.matchsim.trace;

import com.gnovoa.matchsim.model.TeamSide;

/**
 * Filter over recorded traces. Null components match everything.
 */
public record TraceQuery(Integer minute, TeamSide team, AiTraceType type) {

    public static TraceQuery all() {
        return new TraceQuery(null, null, null);
    }

    public boolean matches(AiTraceEvent event) {
        if (minute != null && event.minute() != minute) return false;
        if (team != null && event.team() != team) return false;
        return type == null || event.type() == type;
    }
}
