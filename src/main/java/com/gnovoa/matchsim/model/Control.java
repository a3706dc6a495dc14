package com.gnovoa.matchsim.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Who makes in-match decisions for a side. Only {@link #AI} sides get automatic substitutions. */
public enum Control {
  AI,
  HUMAN;

  @JsonValue
  public String wire() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static Control fromWire(String value) {
    return Control.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
