package com.vitals.analytics.service;

import com.vitals.analytics.model.AlertSeverity;
import com.vitals.analytics.model.AnomalyEvent;
import com.vitals.analytics.model.Reading;
import com.vitals.analytics.model.Threshold;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Applies thresholds to values. Stateless: the live consumer and the backfill path
 * share one instance across threads.
 */
@Component
public class AnomalyEvaluator {

  private static final Logger log = LoggerFactory.getLogger(AnomalyEvaluator.class);

  private final Clock clock;

  public AnomalyEvaluator(Clock clock) {
    this.clock = clock;
  }

  /**
   * One candidate anomaly per violated threshold whose metric is present in the reading.
   * Candidates are not yet persisted.
   */
  public List<AnomalyEvent> evaluate(Reading reading, Collection<Threshold> thresholds) {
    if (thresholds == null || thresholds.isEmpty()) return List.of();

    List<AnomalyEvent> out = new ArrayList<>();
    for (Threshold th : thresholds) {
      OptionalDouble value = reading.value(th.getMetric());
      if (value.isEmpty()) continue;
      check(th, reading.patientId(), value.getAsDouble(), reading.timestamp()).ifPresent(out::add);
    }
    return out;
  }

  /** Bounds are exclusive: a value equal to min or max is in range. */
  public Optional<AnomalyEvent> check(Threshold th, UUID patientId, double value, Instant observedAt) {
    String description = describeViolation(th, value);
    if (description == null) return Optional.empty();

    log.debug("Violation patient={} {}", patientId, description);
    return Optional.of(new AnomalyEvent(
        patientId,
        th.getMetric(),
        value,
        AlertSeverity.WARNING,
        description,
        observedAt,
        th.getId(),
        clock.instant()
    ));
  }

  static String describeViolation(Threshold th, double value) {
    String metric = th.getMetric().wireName();
    if (th.getMinValue() != null && value < th.getMinValue()) {
      return metric + " " + value + " < min " + formatBound(th.getMinValue());
    }
    if (th.getMaxValue() != null && value > th.getMaxValue()) {
      return metric + " " + value + " > max " + formatBound(th.getMaxValue());
    }
    return null;
  }

  // 100.0 -> "100", 99.50 -> "99.5"
  static String formatBound(double bound) {
    return BigDecimal.valueOf(bound).stripTrailingZeros().toPlainString();
  }
}
