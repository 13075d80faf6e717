package com.vitals.analytics.controller;

import com.vitals.analytics.client.PatientDirectoryClient;
import com.vitals.analytics.controller.dto.AnomalyResponse;
import com.vitals.analytics.service.AnomalyStore;
import com.vitals.analytics.service.BackfillService;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AnomaliesController {
  private final AnomalyStore store;
  private final BackfillService backfill;
  private final PatientDirectoryClient patients;

  public AnomaliesController(AnomalyStore store, BackfillService backfill, PatientDirectoryClient patients) {
    this.store = store;
    this.backfill = backfill;
    this.patients = patients;
  }

  /** Newest first. */
  @GetMapping("/anomalies/{patientId}")
  public List<AnomalyResponse> list(@PathVariable("patientId") UUID patientId) {
    patients.ensureExists(patientId);
    return store.listForPatient(patientId).stream().map(AnomalyResponse::from).toList();
  }

  /** Oldest first, both ends inclusive. {@code start} and {@code end} are ISO-8601 instants. */
  @GetMapping("/anomalies/{patientId}/range")
  public List<AnomalyResponse> range(
      @PathVariable("patientId") UUID patientId,
      @RequestParam("start") Instant start,
      @RequestParam("end") Instant end
  ) {
    patients.ensureExists(patientId);
    return store.listForPatientInRange(patientId, start, end).stream().map(AnomalyResponse::from).toList();
  }

  /** Re-checks the recent telemetry window. Does not skip anomalies recorded earlier. */
  @PostMapping("/analyze/{patientId}")
  public List<AnomalyResponse> analyze(@PathVariable("patientId") UUID patientId) {
    patients.ensureExists(patientId);
    return backfill.analyzeRecent(patientId).stream().map(AnomalyResponse::from).toList();
  }
}
