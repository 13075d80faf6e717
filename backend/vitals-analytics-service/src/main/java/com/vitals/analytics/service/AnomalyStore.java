package com.vitals.analytics.service;

import com.vitals.analytics.model.AnomalyEvent;
import com.vitals.analytics.repo.AnomalyEventRepository;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Append-only access to anomaly rows. There is no update or delete.
 */
@Service
public class AnomalyStore {

  private final AnomalyEventRepository repo;

  public AnomalyStore(AnomalyEventRepository repo) {
    this.repo = repo;
  }

  /** All rows of the batch commit together or none do. */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public List<AnomalyEvent> append(List<AnomalyEvent> batch) {
    if (batch == null || batch.isEmpty()) return List.of();
    List<AnomalyEvent> saved = repo.saveAll(batch);
    repo.flush();
    return List.copyOf(saved);
  }

  @Transactional(readOnly = true)
  public List<AnomalyEvent> listForPatient(UUID patientId) {
    return repo.findByPatientIdOrderByTimestampDescIdDesc(patientId);
  }

  @Transactional(readOnly = true)
  public List<AnomalyEvent> listForPatientInRange(UUID patientId, Instant start, Instant end) {
    if (start.isAfter(end)) {
      throw new IllegalArgumentException("start " + start + " is after end " + end);
    }
    return repo.findByPatientIdAndTimestampBetweenOrderByTimestampAscIdAsc(patientId, start, end);
  }
}
