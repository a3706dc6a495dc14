package com.gnovoa.matchsim.api.dto;

import com.gnovoa.matchsim.trace.AiTraceEvent;

import java.util.List;
import java.util.Map;

/**
 * @param dropped oldest traces evicted once the per-match cap was reached
 */
public record TracesResponse(
        String matchId,
        boolean enabled,
        long dropped,
        Map<String, Integer> countsByType,
        List<AiTraceEvent> events
) {}
