package com.vitals.analytics.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * A recorded threshold violation. Rows are append-only.
 *
 * <p>{@code thresholdId} is a plain column rather than a foreign key: the anomaly
 * outlives the threshold that produced it.
 */
@Entity
@Table(
  name = "anomalies",
  indexes = {
    @Index(name = "idx_anomalies_patient_observed_at", columnList = "patientId,observed_at")
  }
)
public class AnomalyEvent {
  public static final int DESCRIPTION_LENGTH = 1024;

  @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(nullable = false, updatable = false) private UUID patientId;

  // when the reading was taken, not when the row was written
  @Column(name = "observed_at", nullable = false, updatable = false)
  private Instant timestamp;

  @Column(nullable = false, updatable = false) private Instant createdAt;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false, updatable = false, length = 32)
  private MetricType metric;

  @Column(nullable = false, updatable = false) private double observedValue;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false, updatable = false, length = 16)
  private AlertSeverity severity;

  // bounds print in plain notation, so a description can run to a few hundred characters
  @Column(nullable = false, updatable = false, length = AnomalyEvent.DESCRIPTION_LENGTH)
  private String description;

  @Column(updatable = false) private Long thresholdId;

  protected AnomalyEvent() {}

  public AnomalyEvent(UUID patientId, MetricType metric, double observedValue, AlertSeverity severity,
                      String description, Instant timestamp, Long thresholdId, Instant createdAt) {
    this.patientId = patientId;
    this.metric = metric;
    this.observedValue = observedValue;
    this.severity = severity;
    this.description = description;
    this.timestamp = timestamp;
    this.thresholdId = thresholdId;
    this.createdAt = createdAt;
  }

  public Long getId() { return id; }
  public UUID getPatientId() { return patientId; }
  public Instant getTimestamp() { return timestamp; }
  public Instant getCreatedAt() { return createdAt; }
  public MetricType getMetric() { return metric; }
  public double getObservedValue() { return observedValue; }
  public AlertSeverity getSeverity() { return severity; }
  public String getDescription() { return description; }
  public Long getThresholdId() { return thresholdId; }

  @Override
  public String toString() {
    return "AnomalyEvent{id=" + id + ", patientId=" + patientId + ", description='" + description
        + "', timestamp=" + timestamp + '}';
  }
}
