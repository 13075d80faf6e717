package com.vitals.analytics.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vitals.analytics.model.MetricType;
import jakarta.validation.constraints.NotNull;
import java.util.UUID;

public record ThresholdRequest(
    @NotNull @JsonProperty("patient_id") UUID patientId,
    @NotNull MetricType metric,
    @JsonProperty("min_value") Double minValue,
    @JsonProperty("max_value") Double maxValue
) {}
