package com.vitals.analytics.service;

import com.vitals.analytics.consumer.ReadingDecodeException;
import com.vitals.analytics.consumer.ReadingDecoder;
import com.vitals.analytics.model.AnomalyEvent;
import com.vitals.analytics.model.Reading;
import com.vitals.analytics.model.Threshold;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * decode -> evaluate -> persist -> dispatch for one bus message.
 *
 * <p>Holds no per-message state, so messages for different patients may be handled
 * concurrently. Every failure is contained to the message that caused it.
 */
@Component
public class VitalSignProcessor {

  private static final Logger log = LoggerFactory.getLogger(VitalSignProcessor.class);

  private final ReadingDecoder decoder;
  private final ThresholdRegistry registry;
  private final AnomalyEvaluator evaluator;
  private final AnomalyStore store;
  private final AlertDispatcher dispatcher;
  private final MeterRegistry metrics;

  private final Counter readingsRejected;
  private final Counter anomaliesRecorded;
  private final Counter persistFailures;
  private final Counter dispatchErrors;
  private final Timer evaluationDuration;

  public VitalSignProcessor(ReadingDecoder decoder,
                            ThresholdRegistry registry,
                            AnomalyEvaluator evaluator,
                            AnomalyStore store,
                            AlertDispatcher dispatcher,
                            MeterRegistry metrics) {
    this.decoder = decoder;
    this.registry = registry;
    this.evaluator = evaluator;
    this.store = store;
    this.dispatcher = dispatcher;
    this.metrics = metrics;
    this.readingsRejected = metrics.counter("vitals_readings_rejected_total");
    this.anomaliesRecorded = metrics.counter("vitals_anomalies_recorded_total");
    this.persistFailures = metrics.counter("vitals_anomaly_persist_failures_total");
    this.dispatchErrors = metrics.counter("vitals_alert_dispatch_errors_total");
    this.evaluationDuration = metrics.timer("vitals_reading_evaluation_duration_seconds");
  }

  /**
   * @return the anomalies persisted for this message; empty when the message was
   *         dropped, nothing was violated, or the batch could not be stored
   */
  public List<AnomalyEvent> handleMessage(byte[] payload) {
    Reading reading;
    try {
      reading = decoder.decode(payload);
    } catch (ReadingDecodeException e) {
      readingsRejected.increment();
      log.warn("Dropping undecodable reading: {}", e.getMessage());
      return List.of();
    }
    return handleReading(reading);
  }

  public List<AnomalyEvent> handleReading(Reading reading) {
    List<AnomalyEvent> persisted;
    Timer.Sample sample = Timer.start(metrics);
    try {
      persisted = evaluateAndStore(reading);
    } finally {
      sample.stop(evaluationDuration);
    }
    for (AnomalyEvent anomaly : persisted) {
      dispatch(anomaly);
    }
    return persisted;
  }

  // one failed alert must not cost the others, nor the already stored anomaly
  private void dispatch(AnomalyEvent anomaly) {
    try {
      dispatcher.dispatch(anomaly);
    } catch (RuntimeException e) {
      dispatchErrors.increment();
      log.error("Alert dispatch threw for anomaly id={} patient={}: {}",
          anomaly.getId(), anomaly.getPatientId(), e.getMessage(), e);
    }
  }

  private List<AnomalyEvent> evaluateAndStore(Reading reading) {
    List<Threshold> thresholds = registry.listForPatient(reading.patientId());
    if (thresholds.isEmpty()) {
      log.debug("No thresholds configured for patient={}", reading.patientId());
      return List.of();
    }

    List<AnomalyEvent> candidates = evaluator.evaluate(reading, thresholds);
    if (candidates.isEmpty()) return List.of();

    try {
      List<AnomalyEvent> saved = store.append(candidates);
      anomaliesRecorded.increment(saved.size());
      log.info("Recorded {} anomaly(ies) for patient={} at {}",
          saved.size(), reading.patientId(), reading.timestamp());
      return saved;
    } catch (DataAccessException e) {
      persistFailures.increment();
      log.error("Failed to persist {} anomaly(ies) for patient={} at {}: {}",
          candidates.size(), reading.patientId(), reading.timestamp(), e.getMessage());
      return List.of();
    }
  }
}
