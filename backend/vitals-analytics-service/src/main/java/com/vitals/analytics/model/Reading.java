package com.vitals.analytics.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.UUID;

/**
 * One timestamped set of metric values for a patient, as decoded from the bus.
 * Metrics that were absent (or null) in the payload are simply not in {@code values}.
 */
public record Reading(UUID patientId, Instant timestamp, Map<MetricType, Double> values) {

  public Reading {
    Objects.requireNonNull(patientId, "patientId must not be null");
    Objects.requireNonNull(timestamp, "timestamp must not be null");
    EnumMap<MetricType, Double> copy = new EnumMap<>(MetricType.class);
    if (values != null) {
      values.forEach((k, v) -> {
        if (k != null && v != null) copy.put(k, v);
      });
    }
    values = Collections.unmodifiableMap(copy);
  }

  public OptionalDouble value(MetricType metric) {
    Double v = values.get(metric);
    return v == null ? OptionalDouble.empty() : OptionalDouble.of(v);
  }
}
