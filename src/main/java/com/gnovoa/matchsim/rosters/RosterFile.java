package com.gnovoa.matchsim.rosters;

import com.gnovoa.matchsim.model.Team;
import java.util.List;

/** JSON shape of a roster file: a named group of teams. */
public record RosterFile(String name, List<Team> teams) {}
