package com.vitals.analytics.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Optional;

/**
 * Physiological measurements that can carry a per-patient threshold.
 * The wire name is the field name used on the bus and in the HTTP API.
 */
public enum MetricType {
  HEART_RATE("heart_rate"),
  SPO2("spo2"),
  RESPIRATORY_RATE("respiratory_rate"),
  SYSTOLIC_BP("systolic_bp"),
  DIASTOLIC_BP("diastolic_bp"),
  TEMPERATURE("temperature"),
  GLUCOSE("glucose");

  private final String wireName;

  MetricType(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  public static Optional<MetricType> lookup(String name) {
    if (name == null) return Optional.empty();
    String norm = name.trim().toLowerCase(Locale.ROOT);
    for (MetricType m : values()) {
      if (m.wireName.equals(norm)) return Optional.of(m);
    }
    return Optional.empty();
  }

  @JsonCreator
  public static MetricType fromWire(String name) {
    return lookup(name).orElseThrow(() -> new IllegalArgumentException("Unsupported metric: " + name));
  }

  @Override
  public String toString() {
    return wireName;
  }
}
