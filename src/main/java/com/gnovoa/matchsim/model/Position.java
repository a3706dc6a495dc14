package com.gnovoa.matchsim.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Simplified playing positions. */
public enum Position {
  GK,
  DEF,
  MID,
  ATT;

  @JsonValue
  public String wire() {
    return name();
  }

  @JsonCreator
  public static Position fromWire(String value) {
    return Position.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
