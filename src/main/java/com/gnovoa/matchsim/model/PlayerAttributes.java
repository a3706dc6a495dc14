package com.gnovoa.matchsim.model;

/** Classic 1-99 attribute sheet. Goalkeeping attributes only matter for goalkeepers. */
public record PlayerAttributes(
    int speed,
    int strength,
    int stamina,
    int shooting,
    int passing,
    int dribbling,
    int heading,
    int tackling,
    int positioning,
    int vision,
    int composure,
    int aggression,
    int reflexes,
    int handling,
    int diving) {

  /** Every attribute set to the same value; handy for fixtures and generated squads. */
  public static PlayerAttributes uniform(int value) {
    return new PlayerAttributes(
        value, value, value, value, value, value, value, value, value, value, value, value, value,
        value, value);
  }
}
