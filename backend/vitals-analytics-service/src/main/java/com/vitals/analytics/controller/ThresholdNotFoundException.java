package com.vitals.analytics.controller;

import com.vitals.analytics.model.MetricType;
import java.util.UUID;

public class ThresholdNotFoundException extends RuntimeException {
  public ThresholdNotFoundException(UUID patientId, MetricType metric) {
    super("Threshold not found for patient " + patientId + " and metric " + metric);
  }
}
