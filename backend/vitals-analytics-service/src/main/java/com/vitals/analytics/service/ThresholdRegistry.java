package com.vitals.analytics.service;

import com.vitals.analytics.model.MetricType;
import com.vitals.analytics.model.Threshold;
import com.vitals.analytics.repo.ThresholdRepository;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Owns the per-patient, per-metric limits.
 *
 * <p>Readers take whatever rows are committed when they ask; no lock is held against
 * concurrent administrative edits. Writers are serialized by the
 * {@code (patient_id, metric)} unique constraint: a losing concurrent insert is retried
 * as an update of the row the winner created.
 */
@Service
public class ThresholdRegistry {

  private static final Logger log = LoggerFactory.getLogger(ThresholdRegistry.class);
  static final int MAX_UPSERT_ATTEMPTS = 3;

  private final ThresholdRepository repo;
  private final TransactionTemplate tx;
  private final Clock clock;

  public ThresholdRegistry(ThresholdRepository repo, PlatformTransactionManager txManager, Clock clock) {
    this.repo = repo;
    this.tx = new TransactionTemplate(txManager);
    this.tx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    this.clock = clock;
  }

  /** Empty means "no monitoring configured" for the patient. */
  public List<Threshold> listForPatient(UUID patientId) {
    Objects.requireNonNull(patientId, "patientId must not be null");
    return repo.findByPatientIdOrderByMetricAsc(patientId);
  }

  public Optional<Threshold> find(UUID patientId, MetricType metric) {
    return repo.findByPatientIdAndMetric(patientId, metric);
  }

  public Threshold upsert(UUID patientId, MetricType metric, Double min, Double max) {
    validate(patientId, metric, min, max);
    for (int attempt = 1; ; attempt++) {
      try {
        return tx.execute(status -> upsertOnce(patientId, metric, min, max));
      } catch (DataIntegrityViolationException e) {
        if (attempt >= MAX_UPSERT_ATTEMPTS) {
          log.error("Threshold upsert for patient={} metric={} still conflicting after {} attempts",
              patientId, metric, attempt);
          throw e;
        }
        log.info("Concurrent threshold insert for patient={} metric={}; retrying as update (attempt {})",
            patientId, metric, attempt + 1);
      }
    }
  }

  private Threshold upsertOnce(UUID patientId, MetricType metric, Double min, Double max) {
    Optional<Threshold> existing = repo.findByPatientIdAndMetric(patientId, metric);
    if (existing.isPresent()) {
      Threshold th = existing.get();
      th.updateBounds(min, max, clock.instant());
      Threshold saved = repo.saveAndFlush(th);
      log.info("Updated threshold id={} patient={} metric={} min={} max={}",
          saved.getId(), patientId, metric, min, max);
      return saved;
    }
    Threshold saved = repo.saveAndFlush(new Threshold(patientId, metric, min, max, clock.instant()));
    log.info("Created threshold id={} patient={} metric={} min={} max={}",
        saved.getId(), patientId, metric, min, max);
    return saved;
  }

  private static void validate(UUID patientId, MetricType metric, Double min, Double max) {
    if (patientId == null) throw new InvalidThresholdException("patient_id is required");
    if (metric == null) throw new InvalidThresholdException("metric is required");
    if (min != null && (min.isNaN() || min.isInfinite())) {
      throw new InvalidThresholdException("min_value must be a finite number");
    }
    if (max != null && (max.isNaN() || max.isInfinite())) {
      throw new InvalidThresholdException("max_value must be a finite number");
    }
    if (min != null && max != null && min > max) {
      throw new InvalidThresholdException("min_value " + min + " is greater than max_value " + max);
    }
  }
}
