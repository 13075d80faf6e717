package com.vitals.analytics.service;

import com.vitals.analytics.client.TelemetryHistoryClient;
import com.vitals.analytics.client.TelemetryHistoryClient.HistoryPoint;
import com.vitals.analytics.model.AnomalyEvent;
import com.vitals.analytics.model.Threshold;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Manual re-analysis of historical telemetry with the same violation rules as the live
 * stream.
 *
 * <p>Nothing here checks what was recorded before: running twice over overlapping
 * windows records the same violations twice. Backfilled anomalies are not dispatched
 * as alerts.
 */
@Service
public class BackfillService {

  private static final Logger log = LoggerFactory.getLogger(BackfillService.class);

  private final ThresholdRegistry registry;
  private final AnomalyEvaluator evaluator;
  private final AnomalyStore store;
  private final TelemetryHistoryClient history;
  private final Clock clock;
  private final Duration window;

  public BackfillService(ThresholdRegistry registry,
                         AnomalyEvaluator evaluator,
                         AnomalyStore store,
                         TelemetryHistoryClient history,
                         Clock clock,
                         @Value("${vitals.backfill.window-minutes:60}") long windowMinutes) {
    this.registry = registry;
    this.evaluator = evaluator;
    this.store = store;
    this.history = history;
    this.clock = clock;
    this.window = Duration.ofMinutes(windowMinutes);
  }

  public List<AnomalyEvent> analyzeRecent(UUID patientId) {
    Instant end = clock.instant();
    return analyze(patientId, end.minus(window), end);
  }

  public List<AnomalyEvent> analyze(UUID patientId, Instant start, Instant end) {
    if (start.isAfter(end)) {
      throw new IllegalArgumentException("start " + start + " is after end " + end);
    }
    List<Threshold> thresholds = registry.listForPatient(patientId);
    if (thresholds.isEmpty()) return List.of();

    List<AnomalyEvent> found = new ArrayList<>();
    for (Threshold th : thresholds) {
      List<HistoryPoint> points = history.fetch(patientId, th.getMetric(), start, end);
      for (HistoryPoint p : points) {
        evaluator.check(th, patientId, p.value(), p.timestamp()).ifPresent(found::add);
      }
    }

    List<AnomalyEvent> saved = store.append(found);
    log.info("Backfill patient={} window=[{}, {}] thresholds={} anomalies={}",
        patientId, start, end, thresholds.size(), saved.size());
    return saved;
  }
}
