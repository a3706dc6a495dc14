package com.gnovoa.matchsim.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum TeamSide {
  HOME,
  AWAY;

  public TeamSide opposite() {
    return this == HOME ? AWAY : HOME;
  }

  @JsonValue
  public String wire() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static TeamSide fromWire(String value) {
    return TeamSide.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
