package com.vitals.analytics.controller;

import com.vitals.analytics.client.PatientDirectoryClient;
import com.vitals.analytics.controller.dto.ThresholdRequest;
import com.vitals.analytics.controller.dto.ThresholdResponse;
import com.vitals.analytics.model.MetricType;
import com.vitals.analytics.service.ThresholdRegistry;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ThresholdsController {

  private final ThresholdRegistry registry;
  private final PatientDirectoryClient patients;

  public ThresholdsController(ThresholdRegistry registry, PatientDirectoryClient patients) {
    this.registry = registry;
    this.patients = patients;
  }

  @GetMapping("/thresholds/{patientId}")
  public List<ThresholdResponse> list(@PathVariable("patientId") UUID patientId) {
    patients.ensureExists(patientId);
    return registry.listForPatient(patientId).stream().map(ThresholdResponse::from).toList();
  }

  @PostMapping("/thresholds")
  public ThresholdResponse upsert(@Valid @RequestBody ThresholdRequest req) {
    patients.ensureExists(req.patientId());
    return ThresholdResponse.from(
        registry.upsert(req.patientId(), req.metric(), req.minValue(), req.maxValue()));
  }

  @GetMapping("/thresholds/{patientId}/{metric}")
  public ThresholdResponse get(@PathVariable("patientId") UUID patientId,
                               @PathVariable("metric") MetricType metric) {
    patients.ensureExists(patientId);
    return registry.find(patientId, metric)
        .map(ThresholdResponse::from)
        .orElseThrow(() -> new ThresholdNotFoundException(patientId, metric));
  }
}
