package com.vitals.analytics.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vitals.analytics.model.MetricType;
import com.vitals.analytics.model.Threshold;
import java.time.Instant;
import java.util.UUID;

public record ThresholdResponse(
    Long id,
    @JsonProperty("patient_id") UUID patientId,
    MetricType metric,
    @JsonProperty("min_value") Double minValue,
    @JsonProperty("max_value") Double maxValue,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt
) {
  public static ThresholdResponse from(Threshold th) {
    return new ThresholdResponse(th.getId(), th.getPatientId(), th.getMetric(), th.getMinValue(),
        th.getMaxValue(), th.getCreatedAt(), th.getUpdatedAt());
  }
}
