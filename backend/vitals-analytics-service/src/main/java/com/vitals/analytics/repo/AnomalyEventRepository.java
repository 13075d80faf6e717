package com.vitals.analytics.repo;

import com.vitals.analytics.model.AnomalyEvent;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AnomalyEventRepository extends JpaRepository<AnomalyEvent, Long> {
  List<AnomalyEvent> findByPatientIdOrderByTimestampDescIdDesc(UUID patientId);

  List<AnomalyEvent> findByPatientIdAndTimestampBetweenOrderByTimestampAscIdAsc(
      UUID patientId, Instant start, Instant end);
}
