package com.vitals.analytics.client;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vitals.analytics.model.AlertSeverity;
import java.util.UUID;

/** Body of {@code POST /notifications/send} on the alerting service. */
public record AlertNotification(
    @JsonProperty("patient_id") UUID patientId,
    String message,
    AlertSeverity severity
) {}
