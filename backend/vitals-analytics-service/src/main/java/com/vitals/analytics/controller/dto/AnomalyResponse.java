package com.vitals.analytics.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vitals.analytics.model.AlertSeverity;
import com.vitals.analytics.model.AnomalyEvent;
import com.vitals.analytics.model.MetricType;
import java.time.Instant;
import java.util.UUID;

public record AnomalyResponse(
    Long id,
    @JsonProperty("patient_id") UUID patientId,
    MetricType metric,
    AlertSeverity severity,
    @JsonProperty("observed_value") double observedValue,
    String description,
    Instant timestamp,
    @JsonProperty("threshold_id") Long thresholdId
) {
  public static AnomalyResponse from(AnomalyEvent ev) {
    return new AnomalyResponse(ev.getId(), ev.getPatientId(), ev.getMetric(), ev.getSeverity(),
        ev.getObservedValue(), ev.getDescription(), ev.getTimestamp(), ev.getThresholdId());
  }
}
