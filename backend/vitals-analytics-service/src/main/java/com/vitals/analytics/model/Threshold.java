package com.vitals.analytics.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
  name = "thresholds",
  indexes = {
    @Index(name = "idx_thresholds_patient", columnList = "patientId")
  },
  uniqueConstraints = {
    @UniqueConstraint(name = "unique_patient_metric_threshold", columnNames = {"patientId", "metric"})
  }
)
public class Threshold {
  @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(nullable = false) private UUID patientId;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 32)
  private MetricType metric;

  // either bound may be absent, e.g. a fever rule only sets a max
  private Double minValue;
  private Double maxValue;

  @Column(nullable = false) private Instant createdAt;
  @Column(nullable = false) private Instant updatedAt;

  protected Threshold() {}

  public Threshold(UUID patientId, MetricType metric, Double minValue, Double maxValue, Instant now) {
    this.patientId = patientId;
    this.metric = metric;
    this.minValue = minValue;
    this.maxValue = maxValue;
    this.createdAt = now;
    this.updatedAt = now;
  }

  /** Replaces both bounds in place; the row keeps its id and creation time. */
  public void updateBounds(Double minValue, Double maxValue, Instant now) {
    this.minValue = minValue;
    this.maxValue = maxValue;
    this.updatedAt = now;
  }

  public Long getId() { return id; }
  public UUID getPatientId() { return patientId; }
  public MetricType getMetric() { return metric; }
  public Double getMinValue() { return minValue; }
  public Double getMaxValue() { return maxValue; }
  public Instant getCreatedAt() { return createdAt; }
  public Instant getUpdatedAt() { return updatedAt; }

  @Override
  public String toString() {
    return "Threshold{id=" + id + ", patientId=" + patientId + ", metric=" + metric
        + ", min=" + minValue + ", max=" + maxValue + '}';
  }
}
