package com.vitals.analytics.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.vitals.analytics.model.MetricType;
import com.vitals.analytics.model.Threshold;
import com.vitals.analytics.repo.ThresholdRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;

class ThresholdRegistryRetryTest {

  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

  private final ThresholdRepository repo = mock(ThresholdRepository.class);
  private final PlatformTransactionManager txManager = mock(PlatformTransactionManager.class);
  private final ThresholdRegistry registry =
      new ThresholdRegistry(repo, txManager, Clock.fixed(NOW, ZoneOffset.UTC));

  @Test
  @DisplayName("A lost insert race is retried as an update of the winner's row")
  void retriesAsUpdate() {
    UUID patient = UUID.randomUUID();
    Threshold winner = new Threshold(patient, MetricType.HEART_RATE, 55.0, 95.0, NOW);
    when(repo.findByPatientIdAndMetric(patient, MetricType.HEART_RATE))
        .thenReturn(Optional.empty())
        .thenReturn(Optional.of(winner));
    when(repo.saveAndFlush(any(Threshold.class)))
        .thenThrow(new DataIntegrityViolationException("unique_patient_metric_threshold"))
        .thenAnswer(inv -> inv.getArgument(0));

    Threshold result = registry.upsert(patient, MetricType.HEART_RATE, 60.0, 100.0);

    assertThat(result).isSameAs(winner);
    assertThat(result.getMinValue()).isEqualTo(60.0);
    assertThat(result.getMaxValue()).isEqualTo(100.0);
    verify(repo, times(2)).saveAndFlush(any(Threshold.class));
  }

  @Test
  @DisplayName("Gives up after the bounded number of attempts")
  void givesUp() {
    UUID patient = UUID.randomUUID();
    when(repo.findByPatientIdAndMetric(patient, MetricType.SPO2)).thenReturn(Optional.empty());
    when(repo.saveAndFlush(any(Threshold.class)))
        .thenThrow(new DataIntegrityViolationException("unique_patient_metric_threshold"));

    assertThatThrownBy(() -> registry.upsert(patient, MetricType.SPO2, 90.0, null))
        .isInstanceOf(DataIntegrityViolationException.class);
    verify(repo, times(ThresholdRegistry.MAX_UPSERT_ATTEMPTS)).saveAndFlush(any(Threshold.class));
  }
}
