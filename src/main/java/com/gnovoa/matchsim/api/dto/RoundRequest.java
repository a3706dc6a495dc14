package com.gnovoa.matchsim.api.dto;

import java.util.List;

/**
 * Request body for {@code POST /api/rounds}.
 *
 * @param instant simulate every match to full time in parallel instead of pacing them live
 */
public record RoundRequest(List<Pairing> matches, Boolean trace, Boolean instant) {

    public record Pairing(String homeTeamId, String awayTeamId, Long seed) {}
}
