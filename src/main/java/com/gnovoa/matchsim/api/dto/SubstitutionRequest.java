package com.gnovoa.matchsim.api.dto;

import com.gnovoa.matchsim.model.TeamSide;

public record SubstitutionRequest(TeamSide side, String outgoingPlayerId, String incomingPlayerId) {}
