package com.gnovoa.matchsim.api.dto;

import java.util.Map;

public record MatchCreatedResponse(String matchId, long seed, boolean traced, Map<String, String> ws) {}
