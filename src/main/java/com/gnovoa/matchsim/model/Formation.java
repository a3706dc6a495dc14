package com.gnovoa.matchsim.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Supported formations and the number of outfield players per line.
 *
 * <p>{@code 4-2-3-1} counts its three attacking midfielders as midfielders.
 */
public enum Formation {
  F_4_4_2("4-4-2", 4, 4, 2),
  F_4_3_3("4-3-3", 4, 3, 3),
  F_4_2_3_1("4-2-3-1", 4, 5, 1),
  F_3_5_2("3-5-2", 3, 5, 2),
  F_4_5_1("4-5-1", 4, 5, 1),
  F_5_3_2("5-3-2", 5, 3, 2),
  F_5_4_1("5-4-1", 5, 4, 1),
  F_3_4_3("3-4-3", 3, 4, 3);

  private final String label;
  private final int defenders;
  private final int midfielders;
  private final int attackers;

  Formation(String label, int defenders, int midfielders, int attackers) {
    this.label = label;
    this.defenders = defenders;
    this.midfielders = midfielders;
    this.attackers = attackers;
  }

  public String label() { return label; }
  public int defenders() { return defenders; }
  public int midfielders() { return midfielders; }
  public int attackers() { return attackers; }

  public static Optional<Formation> fromLabel(String label) {
    if (label == null) return Optional.empty();
    String trimmed = label.trim();
    return Arrays.stream(values()).filter(f -> f.label.equals(trimmed)).findFirst();
  }
}
