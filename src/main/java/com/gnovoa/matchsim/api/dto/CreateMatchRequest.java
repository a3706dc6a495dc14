package com.gnovoa.matchsim.api.dto;

import com.gnovoa.matchsim.model.Control;
import com.gnovoa.matchsim.model.Tactics;

/**
 * Request body for {@code POST /api/matches}. Missing tactics are picked from the roster, a
 * missing seed is drawn at random and returned.
 */
public record CreateMatchRequest(
        String homeTeamId,
        String awayTeamId,
        Tactics homeTactics,
        Tactics awayTactics,
        Control homeControl,
        Control awayControl,
        Long seed,
        Boolean trace,
        Boolean neutralVenue
) {}
