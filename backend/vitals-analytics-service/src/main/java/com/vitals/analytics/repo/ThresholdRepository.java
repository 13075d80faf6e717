package com.vitals.analytics.repo;

import com.vitals.analytics.model.MetricType;
import com.vitals.analytics.model.Threshold;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ThresholdRepository extends JpaRepository<Threshold, Long> {
  List<Threshold> findByPatientIdOrderByMetricAsc(UUID patientId);

  Optional<Threshold> findByPatientIdAndMetric(UUID patientId, MetricType metric);
}
