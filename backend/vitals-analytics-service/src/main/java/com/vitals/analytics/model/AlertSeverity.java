package com.vitals.analytics.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum AlertSeverity {
  INFO,
  WARNING,
  CRITICAL;

  @JsonValue
  public String wireValue() {
    return name().toLowerCase(Locale.ROOT);
  }
}
