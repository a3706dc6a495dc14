package com.gnovoa.matchsim.api.dto;

import java.util.List;
import java.util.Map;

public record RoundResponse(
        String fixtureId,
        String status,
        Map<String, String> ws,
        List<MatchItem> matches
) {
    public record MatchItem(
            String matchId,
            String homeTeam,
            String awayTeam,
            long seed,
            int homeScore,
            int awayScore,
            Map<String, String> ws
    ) {}
}
