package com.gnovoa.matchsim.model;

import java.util.List;

/**
 * Match tactics. Fixed for the whole match; only the live lineup changes, through substitutions.
 *
 * @param formation formation label, e.g. {@code 4-3-3}
 * @param lineup the 11 starting player ids
 * @param substitutes bench player ids
 */
public record Tactics(String formation, Posture posture, List<String> lineup, List<String> substitutes) {

  public Tactics {
    posture = posture == null ? Posture.BALANCED : posture;
    lineup = lineup == null ? List.of() : List.copyOf(lineup);
    substitutes = substitutes == null ? List.of() : List.copyOf(substitutes);
  }
}
