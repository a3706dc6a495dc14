package com.gnovoa.matchsim.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Tactical posture of a side. */
public enum Posture {
  DEFENSIVE,
  BALANCED,
  ATTACKING;

  @JsonValue
  public String wire() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static Posture fromWire(String value) {
    return Posture.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
