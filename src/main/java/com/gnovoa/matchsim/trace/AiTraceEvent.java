package com.gnovoa.matchsim.trace;

import com.gnovoa.matchsim.model.TeamSide;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single explainability record: what a model saw ({@code inputs}), what it computed
 * ({@code computed}) and what it decided ({@code outcome}).
 *
 * <p>Write-once and consumed only by debug tooling; the simulation never reads it back.
 *
 * @param team side the decision concerns, or null for match-wide computations
 */
public record AiTraceEvent(
        AiTraceType type,
        int minute,
        TeamSide team,
        TraceSeverity severity,
        String summary,
        Map<String, Object> inputs,
        Map<String, Object> computed,
        Map<String, Object> outcome
) {

    public AiTraceEvent {
        severity = severity == null ? TraceSeverity.INFO : severity;
        inputs = frozen(inputs);
        computed = frozen(computed);
        outcome = frozen(outcome);
    }

    public static AiTraceEvent info(AiTraceType type, int minute, TeamSide team, String summary,
                                    Map<String, Object> inputs, Map<String, Object> computed,
                                    Map<String, Object> outcome) {
        return new AiTraceEvent(type, minute, team, TraceSeverity.INFO, summary, inputs, computed, outcome);
    }

    // keeps insertion order (Map.copyOf does not) and tolerates null values
    private static Map<String, Object> frozen(Map<String, Object> source) {
        if (source == null || source.isEmpty()) return Map.of();
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
